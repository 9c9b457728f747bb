package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One processing job.
 *
 * @param parameters process parameters, merged over the configured defaults
 * @param fileIn     input file (may be null)
 * @param fileOut    where the result file is written (may be null)
 * @param timeout    maximum processing time, or null for none
 */
public record ProcessRequest(ObjectNode parameters, Path fileIn, Path fileOut, Duration timeout) {

    public ProcessRequest {
        parameters = parameters == null ? JsonParameters.empty() : parameters.deepCopy();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static ProcessRequest of(ObjectNode parameters) {
        return new ProcessRequest(parameters, null, null, null);
    }

    public static ProcessRequest files(Path fileIn, Path fileOut) {
        return new ProcessRequest(null, fileIn, fileOut, null);
    }

    public ProcessRequest withTimeout(Duration newTimeout) {
        return new ProcessRequest(parameters, fileIn, fileOut, newTimeout);
    }

    @Override
    public ObjectNode parameters() {
        return parameters.deepCopy();
    }
}
