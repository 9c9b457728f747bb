package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Profiling figures returned by the host in {@code app.profiling}.
 *
 * @param wallClockTime     server processing time in seconds
 * @param fpgaElapsedTime   FPGA processing time in seconds
 * @param totalBytesWritten bytes written to the FPGA
 * @param totalBytesRead    bytes read from the FPGA
 */
public record ProfilingReport(
        double wallClockTime,
        double fpgaElapsedTime,
        double totalBytesWritten,
        double totalBytesRead
) {

    private static final double MIB = 1024.0 * 1024.0;

    /**
     * Extracts profiling figures from a host response.
     *
     * @return the report, or empty if the response has no profiling section
     */
    public static Optional<ProfilingReport> from(JsonNode response) {
        JsonNode profiling = response.path("app").path("profiling");
        if (!profiling.isObject()) {
            return Optional.empty();
        }
        return Optional.of(new ProfilingReport(
                profiling.path("wall-clock-time").asDouble(0.0),
                profiling.path("fpga-elapsed-time").asDouble(0.0),
                profiling.path("total-bytes-written").asDouble(0.0),
                profiling.path("total-bytes-read").asDouble(0.0)
        ));
    }

    public double totalBytes() {
        return totalBytesWritten + totalBytesRead;
    }

    /**
     * Server bandwidth in MB/s, or 0 when unknown.
     */
    public double serverBandwidth() {
        return wallClockTime > 0.0 ? totalBytes() / wallClockTime / MIB : 0.0;
    }

    /**
     * FPGA bandwidth in MB/s, or 0 when unknown.
     */
    public double fpgaBandwidth() {
        return fpgaElapsedTime > 0.0 ? totalBytes() / fpgaElapsedTime / MIB : 0.0;
    }

    void log(Logger logger) {
        StringBuilder sb = new StringBuilder("Profiling information from result:");
        if (wallClockTime > 0.0) {
            sb.append(String.format(Locale.ROOT, "%n- Wall clock time: %.3fs", wallClockTime));
            sb.append(String.format(Locale.ROOT, "%n- FPGA elapsed time: %.3fs", fpgaElapsedTime));
        }
        if (serverBandwidth() > 0.0) {
            sb.append(String.format(Locale.ROOT, "%n- Server processing bandwidth: %.1f MB/s", serverBandwidth()));
        }
        if (fpgaBandwidth() > 0.0) {
            sb.append(String.format(Locale.ROOT, "%n- FPGA processing bandwidth: %.1f MB/s", fpgaBandwidth()));
        }
        logger.info(sb.toString());
    }
}
