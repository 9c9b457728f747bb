package io.surfworks.accelforge.pool;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.accelforge.accelerator.Accelerator;
import io.surfworks.accelforge.accelerator.ConfigurationRequest;
import io.surfworks.accelforge.accelerator.ConfigurationResult;
import io.surfworks.accelforge.accelerator.ProcessRequest;
import io.surfworks.accelforge.accelerator.ProcessResult;
import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.host.HostParameters;
import io.surfworks.accelforge.host.StopPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool of identically configured accelerators processing jobs concurrently.
 *
 * <p>Jobs are queued and handed to idle members in round-robin order, skipping busy ones.
 * A member runs one job at a time. The pending queue, the in-flight map and the busy flags
 * are guarded by one lock; the remote calls run outside of it on one worker thread per member.
 *
 * <p>A failing job only fails its own {@link TaskHandle}; a member whose jobs keep failing stays
 * in the rotation. Members never reference the pool.
 *
 * <pre>{@code
 * try (AcceleratorPoolExecutor pool = AcceleratorPoolExecutor.create("sha3", 4, hostParameters, config)) {
 *     pool.start(ConfigurationRequest.defaults());
 *     List<ProcessResult> results = pool.processMap(filesIn, filesOut, null, Duration.ofMinutes(10));
 * }
 * }</pre>
 */
public final class AcceleratorPoolExecutor implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AcceleratorPoolExecutor.class.getName());
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    private final List<Accelerator> members;
    private final ExecutorService workers;
    private final String poolName;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Condition terminated = lock.newCondition();
    private final Deque<PoolTask> pending = new ArrayDeque<>();
    private final Map<PoolTask, Integer> inFlight = new HashMap<>();
    private final boolean[] busy;
    private final boolean[] active;
    private final AtomicLong sequence = new AtomicLong(0);
    private int cursor;
    private boolean started;
    private boolean stopping;
    private volatile boolean stopped;

    /**
     * Creates a pool of {@code size} members, each built by {@code memberFactory}.
     * Members are created concurrently; no remote call is made until {@link #start}.
     *
     * @param size          number of members
     * @param memberFactory creates one accelerator per call, with identical parameters
     * @throws IllegalStateException if a member cannot be created; members already created are closed
     */
    public AcceleratorPoolExecutor(int size, Supplier<Accelerator> memberFactory) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        Objects.requireNonNull(memberFactory, "memberFactory cannot be null");

        this.poolName = "accelforge-pool-" + POOL_COUNTER.incrementAndGet();
        List<Callable<Accelerator>> creations = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            creations.add(memberFactory::get);
        }
        List<Outcome<Accelerator>> created = runConcurrently("create", creations);

        List<Accelerator> built = new ArrayList<>();
        Throwable failure = null;
        for (Outcome<Accelerator> outcome : created) {
            if (outcome.failure() != null) {
                failure = failure == null ? outcome.failure() : failure;
            } else {
                built.add(outcome.value());
            }
        }
        if (failure != null) {
            built.forEach(Accelerator::close);
            throw new IllegalStateException("Unable to create pool members", failure);
        }

        this.members = List.copyOf(built);
        this.busy = new boolean[size];
        this.active = new boolean[size];
        Arrays.fill(active, true);

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.workers = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, poolName + "-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a pool whose members run the named accelerator on hosts of the registered provider.
     */
    public static AcceleratorPoolExecutor create(String accelerator, int size, HostParameters hostParameters,
                                                 Configuration config) {
        return new AcceleratorPoolExecutor(size, () -> Accelerator.create(accelerator, hostParameters, config));
    }

    public List<Accelerator> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    /**
     * Returns the number of members taking part in job dispatch.
     */
    public int activeCount() {
        lock.lock();
        try {
            int count = 0;
            for (boolean a : active) {
                if (a) count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * Starts every member with the {@link StartPolicy#STRICT} policy.
     *
     * @see #start(ConfigurationRequest, StartPolicy)
     */
    public List<ConfigurationResult> start(ConfigurationRequest request) throws PoolStartException {
        return start(request, StartPolicy.STRICT);
    }

    /**
     * Starts (or reconfigures) every active member concurrently.
     *
     * <p>With {@link StartPolicy#STRICT}, any failure stops every member and the pool becomes
     * unusable. With {@link StartPolicy#LENIENT}, failed members are stopped and left out of
     * dispatch; the start only fails if no member started.
     *
     * @param request configuration sent to every member
     * @param policy  reaction to member failures
     * @return the configuration results of the started members, in member order
     * @throws PoolStartException    if the pool cannot be started under the policy
     * @throws IllegalStateException if jobs are queued or running
     */
    public List<ConfigurationResult> start(ConfigurationRequest request, StartPolicy policy)
            throws PoolStartException {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        List<Integer> targets = new ArrayList<>();
        lock.lock();
        try {
            ensureAccepting();
            if (!pending.isEmpty() || !inFlight.isEmpty()) {
                throw new IllegalStateException("Cannot start the pool while jobs are queued or running");
            }
            for (int i = 0; i < members.size(); i++) {
                if (active[i]) {
                    targets.add(i);
                }
            }
        } finally {
            lock.unlock();
        }

        List<Callable<ConfigurationResult>> starts = new ArrayList<>();
        for (int index : targets) {
            Accelerator member = members.get(index);
            starts.add(() -> member.start(request));
        }
        List<Outcome<ConfigurationResult>> outcomes = runConcurrently("start", starts);

        List<Throwable> failures = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        List<ConfigurationResult> results = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            Outcome<ConfigurationResult> outcome = outcomes.get(i);
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
                failed.add(targets.get(i));
                LOG.log(Level.WARNING, "Pool member " + targets.get(i) + " failed to start", outcome.failure());
            } else {
                results.add(outcome.value());
            }
        }

        if (!failures.isEmpty() && (policy == StartPolicy.STRICT || failed.size() == targets.size())) {
            stop(null, true);
            throw new PoolStartException(failed.size() + " of " + targets.size() +
                    " pool members failed to start", failures);
        }

        if (!failed.isEmpty()) {
            List<Callable<Void>> stops = new ArrayList<>();
            for (int index : failed) {
                Accelerator member = members.get(index);
                stops.add(() -> {
                    member.stop(null);
                    return null;
                });
            }
            runConcurrently("stop", stops);
        }

        lock.lock();
        try {
            for (int index : failed) {
                active[index] = false;
            }
            started = true;
        } finally {
            lock.unlock();
        }
        LOG.info("Pool started with " + results.size() + " of " + members.size() + " accelerators");
        return results;
    }

    /**
     * Queues a job and returns immediately.
     *
     * @param request job to run
     * @return handle resolving with the job outcome
     * @throws IllegalStateException      if the pool has not been started
     * @throws RejectedExecutionException if the pool is stopping or stopped
     */
    public TaskHandle submit(ProcessRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        lock.lock();
        try {
            ensureAccepting();
            if (!started) {
                throw new IllegalStateException("Pool has not been started");
            }
            PoolTask task = new PoolTask(sequence.getAndIncrement(), request);
            pending.addLast(task);
            dispatch();
            return new TaskHandle(task, this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every job and returns the results in submission order.
     *
     * <p>Waits for every job to settle. If any job failed, the {@link ExecutionException} of the
     * first failing job, by submission order, is thrown.
     *
     * @param requests jobs to run
     * @param timeout  maximum time to wait for all jobs, or null for no limit
     * @return one result per request, in request order
     * @throws TimeoutException     if the jobs did not settle in time; unfinished jobs are cancelled
     * @throws ExecutionException   if a job failed
     * @throws InterruptedException if interrupted while waiting; unfinished jobs are cancelled
     * @throws RejectedExecutionException if the pool stops while the jobs are submitted; jobs
     *                                    already submitted are cancelled
     */
    public List<ProcessResult> processMap(List<ProcessRequest> requests, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        List<TaskHandle> handles = new ArrayList<>(requests.size());
        try {
            for (ProcessRequest request : requests) {
                handles.add(submit(request));
            }
        } catch (RuntimeException e) {
            handles.forEach(handle -> handle.cancel(false));
            throw e;
        }

        CompletableFuture<?> settled = CompletableFuture
                .allOf(handles.stream().map(TaskHandle::future).toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> null);
        try {
            if (timeout == null) {
                settled.get();
            } else {
                settled.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException | InterruptedException e) {
            handles.forEach(handle -> handle.cancel(false));
            throw e;
        }

        List<ProcessResult> results = new ArrayList<>(handles.size());
        for (TaskHandle handle : handles) {
            results.add(handle.get());
        }
        return results;
    }

    /**
     * Processes files with the same parameters, pairing {@code filesIn} and {@code filesOut} by index.
     *
     * @param filesIn    input files (may be empty)
     * @param filesOut   output files (may be empty)
     * @param parameters process parameters shared by all jobs (may be null)
     * @param timeout    maximum time to wait for all jobs, or null for no limit
     * @throws IllegalArgumentException if both lists are non-empty and their sizes differ
     * @see #processMap(List, Duration)
     */
    public List<ProcessResult> processMap(List<Path> filesIn, List<Path> filesOut, ObjectNode parameters,
                                          Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        List<Path> in = filesIn == null ? List.of() : filesIn;
        List<Path> out = filesOut == null ? List.of() : filesOut;
        if (!in.isEmpty() && !out.isEmpty() && in.size() != out.size()) {
            throw new IllegalArgumentException("filesIn and filesOut must contain the same count of files");
        }

        int count = Math.max(in.size(), out.size());
        List<ProcessRequest> requests = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            requests.add(new ProcessRequest(
                    parameters,
                    in.isEmpty() ? null : in.get(i),
                    out.isEmpty() ? null : out.get(i),
                    null));
        }
        return processMap(requests, timeout);
    }

    /**
     * Stops the pool.
     *
     * <p>New submissions are rejected at once. Without {@code hardCancel}, queued and running jobs
     * are drained first. With it, queued jobs are cancelled and running handles resolve as
     * cancelled. Every member is then stopped concurrently. Calling stop again has no effect
     * beyond waiting for the first call to finish.
     *
     * @param policy     stop policy applied to every member, or null for their default
     * @param hardCancel cancel instead of draining
     */
    public void stop(StopPolicy policy, boolean hardCancel) {
        lock.lock();
        try {
            if (stopping) {
                while (!stopped) {
                    terminated.awaitUninterruptibly();
                }
                return;
            }
            stopping = true;

            if (hardCancel) {
                for (PoolTask task : pending) {
                    task.cancel();
                }
                pending.clear();
                for (PoolTask task : inFlight.keySet()) {
                    task.cancel();
                }
            } else {
                while (!pending.isEmpty() || !inFlight.isEmpty()) {
                    drained.awaitUninterruptibly();
                }
            }
        } finally {
            lock.unlock();
        }

        List<Callable<Void>> stops = new ArrayList<>();
        for (Accelerator member : members) {
            stops.add(() -> {
                member.stop(policy);
                return null;
            });
        }
        for (Outcome<Void> outcome : runConcurrently("stop", stops)) {
            if (outcome.failure() != null) {
                LOG.log(Level.WARNING, "Unable to stop pool member", outcome.failure());
            }
        }

        workers.shutdown();
        lock.lock();
        try {
            stopped = true;
            terminated.signalAll();
        } finally {
            lock.unlock();
        }
        LOG.fine("Pool " + poolName + " stopped");
    }

    /**
     * Drains the pool and stops every member with its default policy.
     */
    @Override
    public void close() {
        stop(null, false);
    }

    boolean cancel(PoolTask task) {
        lock.lock();
        try {
            if (task.state() == TaskState.QUEUED && pending.remove(task)) {
                signalIfDrained();
            }
            // A running task keeps its member busy until the remote call returns
            return task.cancel();
        } finally {
            lock.unlock();
        }
    }

    // Must be called with the lock held
    private void dispatch() {
        while (!pending.isEmpty()) {
            int member = nextIdleMember();
            if (member < 0) {
                return;
            }
            PoolTask task = pending.pollFirst();
            if (!task.markAssigned(member)) {
                continue;
            }
            busy[member] = true;
            inFlight.put(task, member);
            workers.execute(() -> run(task, member));
        }
    }

    private int nextIdleMember() {
        int n = members.size();
        for (int i = 0; i < n; i++) {
            int candidate = (cursor + i) % n;
            if (active[candidate] && !busy[candidate]) {
                cursor = (candidate + 1) % n;
                return candidate;
            }
        }
        return -1;
    }

    private void run(PoolTask task, int member) {
        try {
            if (task.markRunning()) {
                task.complete(members.get(member).process(task.request()));
            }
        } catch (Exception e) {
            task.fail(e);
        } catch (Error e) {
            task.fail(e);
            throw e;
        } finally {
            lock.lock();
            try {
                busy[member] = false;
                inFlight.remove(task);
                dispatch();
                signalIfDrained();
            } finally {
                lock.unlock();
            }
        }
    }

    private void signalIfDrained() {
        if (pending.isEmpty() && inFlight.isEmpty()) {
            drained.signalAll();
        }
    }

    private void ensureAccepting() {
        if (stopping) {
            throw new RejectedExecutionException("Pool is stopped");
        }
    }

    /**
     * Runs calls concurrently on short-lived daemon threads and waits for all of them.
     */
    private <T> List<Outcome<T>> runConcurrently(String purpose, List<Callable<T>> calls) {
        if (calls.isEmpty()) {
            return List.of();
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(calls.size(), r -> {
            Thread t = new Thread(r, poolName + "-" + purpose + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<CompletableFuture<T>> futures = new ArrayList<>();
            for (Callable<T> call : calls) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return call.call();
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                }, executor));
            }
            List<Outcome<T>> outcomes = new ArrayList<>();
            for (CompletableFuture<T> future : futures) {
                outcomes.add(future.handle((value, error) -> new Outcome<>(value, unwrap(error))).join());
            }
            return Collections.unmodifiableList(outcomes);
        } finally {
            executor.shutdown();
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record Outcome<T>(T value, Throwable failure) {
    }

    @Override
    public String toString() {
        return "AcceleratorPoolExecutor[" + poolName + ", size=" + members.size() + "]";
    }
}
