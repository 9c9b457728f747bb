package io.surfworks.accelforge.accelerator;

/**
 * Opens a remote session for a host address. Opening makes no remote call.
 */
@FunctionalInterface
public interface AcceleratorSessionFactory {

    AcceleratorSession open(String address);
}
