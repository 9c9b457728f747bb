package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of an accepted configuration.
 *
 * @param configurationUrl remote reference of the configuration
 * @param response         full response of the host
 */
public record ConfigurationResult(String configurationUrl, ObjectNode response) {
}
