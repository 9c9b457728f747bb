package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Outcome of a processing job.
 *
 * @param specific accelerator specific result ({@code app.specific} of the response)
 * @param response full response of the host, including diagnostics and profiling
 */
public record ProcessResult(ObjectNode specific, ObjectNode response) {

    public ProcessResult {
        specific = specific == null ? JsonParameters.empty() : specific;
        response = response == null ? JsonParameters.empty() : response;
    }

    /**
     * Builds a result from a host response, extracting {@code app.specific}.
     */
    public static ProcessResult fromResponse(ObjectNode response) {
        JsonNode specific = response.path("app").path("specific");
        return new ProcessResult(specific instanceof ObjectNode object ? object : null, response);
    }

    public Optional<ProfilingReport> profiling() {
        return ProfilingReport.from(response);
    }
}
