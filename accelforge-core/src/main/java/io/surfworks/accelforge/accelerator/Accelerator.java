package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.accelforge.accelerator.rest.RestAcceleratorSession;
import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.host.Host;
import io.surfworks.accelforge.host.HostParameters;
import io.surfworks.accelforge.host.ProvisioningException;
import io.surfworks.accelforge.host.StopPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A host paired with a configured remote accelerator session.
 *
 * <p>Lifecycle: {@code start} configures the accelerator (provisioning the host if needed),
 * {@code process} runs jobs, {@code stop} tears the session down and stops the host.
 * A failing {@code process} never stops the host.
 *
 * <p>Default parameters come from the {@code configuration} and {@code process} sections, and
 * their {@code configuration.<name>} and {@code process.<name>} subsections, key
 * {@code parameters}. The accelerator credentials of the {@code accelize} section are sent in
 * the {@code env} object of every configuration.
 */
public final class Accelerator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(Accelerator.class.getName());

    private final String name;
    private final Host host;
    private final AcceleratorSessionFactory sessionFactory;
    private final Configuration config;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SessionState state = SessionState.UNCONFIGURED;
    private volatile ConfigurationRequest lastConfiguration;
    private AcceleratorSession session;
    private boolean sessionReleased;

    /**
     * Creates an accelerator.
     *
     * @param name           accelerator name
     * @param host           host exclusively owned by this accelerator
     * @param sessionFactory opens remote sessions for the host address
     * @param config         configuration holding parameter defaults and credentials
     */
    public Accelerator(String name, Host host, AcceleratorSessionFactory sessionFactory, Configuration config) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.host = Objects.requireNonNull(host, "host cannot be null");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    /**
     * Creates an accelerator on a new {@link Host} of the registered provider, talking to the
     * host over REST.
     */
    public static Accelerator create(String name, HostParameters hostParameters, Configuration config) {
        return new Accelerator(name, Host.create(hostParameters), RestAcceleratorSession::new, config);
    }

    public String name() {
        return name;
    }

    public Host host() {
        return host;
    }

    public SessionState state() {
        return state;
    }

    /**
     * Returns the last configuration accepted by the host.
     */
    public Optional<ConfigurationRequest> lastConfiguration() {
        return Optional.ofNullable(lastConfiguration);
    }

    /**
     * Configures the accelerator, provisioning the host first if it is not ready.
     * Each call fully replaces the previous configuration.
     *
     * @param request configuration to apply
     * @return the host's answer
     * @throws ProvisioningException    if the host cannot be made ready
     * @throws RemoteExecutionException if the host rejects the configuration
     * @throws IllegalStateException    if the accelerator was stopped
     */
    public ConfigurationResult start(ConfigurationRequest request)
            throws ProvisioningException, RemoteExecutionException {
        Objects.requireNonNull(request, "request cannot be null");
        lock.lock();
        try {
            ensureNotStopped();
            AcceleratorSession current = openSession();

            ObjectNode parameters = JsonParameters.merge(defaults("configuration"), request.parameters());
            ObjectNode env = parameters.has("env") && parameters.get("env").isObject()
                    ? (ObjectNode) parameters.get("env")
                    : parameters.putObject("env");
            String clientId = config.resolve("accelize", "client_id", null);
            String secretId = config.resolve("accelize", "secret_id", null);
            if (clientId != null) {
                env.put("client_id", clientId);
            }
            if (secretId != null) {
                env.put("client_secret", secretId);
            }
            request.hostEnv().forEach(env::put);

            LOG.info("Configuring accelerator '" + name + "'...");
            ConfigurationResult result = current.configure(parameters, request.datafile());
            lastConfiguration = request;
            state = SessionState.CONFIGURED;
            LOG.info("Accelerator '" + name + "' ready");
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-attaches to the configuration a reused host still runs, so that {@link #process} can be
     * called without {@link #start}.
     *
     * @return true if the host had an active configuration
     * @throws ProvisioningException    if the host cannot be made ready
     * @throws RemoteExecutionException if the host cannot be queried
     */
    public boolean resume() throws ProvisioningException, RemoteExecutionException {
        lock.lock();
        try {
            ensureNotStopped();
            Optional<String> configuration = openSession().resume();
            if (configuration.isPresent()) {
                state = SessionState.CONFIGURED;
                LOG.fine("Accelerator '" + name + "' resumed configuration " + configuration.get());
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one job.
     *
     * @param request job to run
     * @return the result and the full diagnostics of the host
     * @throws NotConfiguredException   if start() has not succeeded yet; the host is not contacted
     * @throws RemoteExecutionException if processing fails
     */
    public ProcessResult process(ProcessRequest request) throws RemoteExecutionException {
        Objects.requireNonNull(request, "request cannot be null");
        AcceleratorSession current;
        lock.lock();
        try {
            if (state != SessionState.CONFIGURED) {
                throw new NotConfiguredException("Accelerator '" + name + "' has not been configured. " +
                        "Use 'start' first.");
            }
            current = session;
        } finally {
            lock.unlock();
        }

        if (request.fileIn() != null && !Files.isRegularFile(request.fileIn())) {
            throw new RemoteExecutionException("Could not find input file: " + request.fileIn());
        }
        if (request.fileOut() != null) {
            Path parent = request.fileOut().toAbsolutePath().getParent();
            try {
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new RemoteExecutionException("Unable to create output directory " + parent, e);
            }
        }

        ObjectNode parameters = JsonParameters.merge(defaults("process"), request.parameters());
        ProcessResult result = current.execute(parameters, request.fileIn(), request.fileOut(), request.timeout());
        result.profiling().ifPresent(report -> report.log(LOG));
        return result;
    }

    /**
     * Stops the accelerator.
     *
     * <p>The remote session is torn down unless the effective policy is {@link StopPolicy#KEEP},
     * so that a kept host stays configured. Teardown failures are logged. The host is then
     * stopped with the same policy.
     *
     * @param policy stop policy, or null for the host's default
     */
    public void stop(StopPolicy policy) {
        // start() holds the lock while the host provisions
        host.abortProvisioning();
        lock.lock();
        try {
            StopPolicy effective = policy != null ? policy : host.parameters().stopPolicy();
            state = SessionState.STOPPED;
            if (session != null && !sessionReleased && effective != StopPolicy.KEEP) {
                sessionReleased = true;
                try {
                    session.teardown();
                } catch (RemoteExecutionException | RuntimeException e) {
                    LOG.log(Level.WARNING, "Unable to stop accelerator '" + name + "'", e);
                }
            }
            host.stop(policy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops with the default policy and closes the host.
     */
    @Override
    public void close() {
        stop(null);
        host.close();
    }

    private AcceleratorSession openSession() throws ProvisioningException {
        if (session == null) {
            String address = host.ensureReady();
            session = sessionFactory.open(address);
        }
        return session;
    }

    private ObjectNode defaults(String section) {
        ObjectNode base = config.resolveJson(section, "parameters");
        return JsonParameters.merge(base, config.resolveJson(section + "." + name, "parameters"));
    }

    private void ensureNotStopped() {
        if (state == SessionState.STOPPED) {
            throw new IllegalStateException("Accelerator '" + name + "' is stopped");
        }
    }

    @Override
    public String toString() {
        return "Accelerator[" + name + ", " + state + ", " + host + "]";
    }
}
