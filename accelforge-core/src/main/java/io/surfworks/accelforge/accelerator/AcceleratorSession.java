package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Remote session with the accelerator service running on a host.
 *
 * <p>A session is bound to one host address. Calls block until the host answered.
 * One call at a time is made per session.
 */
public interface AcceleratorSession {

    /**
     * Sends a configuration. Replaces any previous configuration of this session.
     *
     * @param parameters full configuration document
     * @param datafile   file to upload, or null
     * @throws RemoteExecutionException if the host rejects the configuration
     */
    ConfigurationResult configure(ObjectNode parameters, Path datafile) throws RemoteExecutionException;

    /**
     * Runs one job with the current configuration.
     *
     * @param parameters full process document
     * @param fileIn     input file to upload, or null
     * @param fileOut    where to write the result file, or null
     * @param timeout    maximum time to wait for the result, or null for none
     * @throws RemoteExecutionException if processing fails
     */
    ProcessResult execute(ObjectNode parameters, Path fileIn, Path fileOut, Duration timeout)
            throws RemoteExecutionException;

    /**
     * Stops the remote accelerator and releases its resources.
     *
     * @throws RemoteExecutionException if the host reports a failure
     */
    void teardown() throws RemoteExecutionException;

    /**
     * Re-attaches to the last configuration the host still uses.
     *
     * @return the configuration reference, or empty if the host has no active configuration
     * @throws RemoteExecutionException if the host cannot be queried
     */
    Optional<String> resume() throws RemoteExecutionException;
}
