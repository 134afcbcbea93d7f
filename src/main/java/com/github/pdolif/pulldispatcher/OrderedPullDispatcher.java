package com.github.pdolif.pulldispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pulls batches of messages from a durable consumer and dispatches every message to a {@link MessageHandler}.
 * <p>
 * At most {@link DispatcherConfig#maxConcurrent()} messages are processed at the same time. When all slots are taken,
 * the fetch loop waits for a free slot before it dispatches further messages and before it fetches the next batch.
 * Messages with the same ordering key are processed one at a time, messages with different keys in parallel.
 * <p>
 * Use {@link #start(DispatcherConfig, MessageQueue)} to create a running dispatcher:
 * <pre>
 * var config = DispatcherConfig.builder()
 *     .stream("public/default")
 *     .subject("orders")
 *     .durableName("order-processor")
 *     .handler(handler)
 *     .build();
 * try (var dispatcher = OrderedPullDispatcher.start(config, new PulsarMessageQueue(pulsarClient))) {
 *     ...
 * }
 * </pre>
 */
public class OrderedPullDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderedPullDispatcher.class);

    static final String FETCH_ERRORS_COUNTER = "pull.dispatcher.fetch.errors";
    private static final Duration IDLE_CHECK_INTERVAL = Duration.ofMillis(100);

    private final String name;
    private final DispatcherConfig config;
    private final PullSubscription subscription;
    private final Metrics metrics;
    private final KeyLockRegistry keyLockRegistry;
    private final AdmissionGate admissionGate;
    private final ExecutorService processorExecutor;
    private final ScheduledThreadPoolExecutor deadlineScheduler;
    private final Thread fetchLoopThread;

    private final ReentrantLock stateLock = new ReentrantLock();
    private DispatcherState state = DispatcherState.ACTIVE;

    private OrderedPullDispatcher(DispatcherConfig config, PullSubscription subscription, Metrics metrics,
                                  ExecutorServiceProvider executorServiceProvider) {
        this.name = config.name();
        this.config = config;
        this.subscription = subscription;
        this.metrics = metrics;
        this.keyLockRegistry = new KeyLockRegistry(name, metrics);
        this.admissionGate = new AdmissionGate(config.maxConcurrent(), name, metrics);
        this.processorExecutor = executorServiceProvider.createProcessorExecutorService(name);
        if (processorExecutor == null) throw new IllegalArgumentException("ExecutorServiceProvider returned null");
        this.deadlineScheduler = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory(name + "-deadline"));
        // cancelled watchdogs would otherwise stay queued until the handler timeout
        this.deadlineScheduler.setRemoveOnCancelPolicy(true);
        this.fetchLoopThread = new NamedThreadFactory(name + "-fetch-loop").newThread(this::fetchLoop);
    }

    /**
     * Registers the durable consumer, opens a pull subscription and starts fetching.
     * @param config Dispatcher configuration
     * @param queue Queue to fetch from
     * @param metrics Metrics instance to monitor in flight messages, locked keys and outcomes
     * @param executorServiceProvider Provider of the executor service message processors run on
     * @return Running dispatcher
     * @throws SetupException if the consumer or subscription could not be created; nothing is started then
     */
    public static OrderedPullDispatcher start(DispatcherConfig config, MessageQueue queue, Metrics metrics,
                                              ExecutorServiceProvider executorServiceProvider) throws SetupException {
        if (config == null) throw new IllegalArgumentException("DispatcherConfig cannot be null");
        if (queue == null) throw new IllegalArgumentException("MessageQueue cannot be null");
        if (metrics == null) throw new IllegalArgumentException("Metrics cannot be null");
        if (executorServiceProvider == null) throw new IllegalArgumentException("ExecutorServiceProvider cannot be null");

        var subscription = queue.subscribe(ConsumerSettings.from(config));
        if (subscription == null) {
            throw new SetupException("Queue returned no subscription for subject " + config.subject());
        }

        OrderedPullDispatcher dispatcher;
        try {
            dispatcher = new OrderedPullDispatcher(config, subscription, metrics, executorServiceProvider);
        } catch (RuntimeException e) {
            closeQuietly(config.name(), subscription);
            throw e;
        }
        dispatcher.fetchLoopThread.start();

        log.info("[{}] Started dispatcher for subject '{}' in stream '{}' with durable name '{}'",
                dispatcher.name, config.subject(), config.stream(), config.durableName());
        return dispatcher;
    }

    public static OrderedPullDispatcher start(DispatcherConfig config, MessageQueue queue, Metrics metrics)
            throws SetupException {
        return start(config, queue, metrics, new PlatformThreadExecutorServiceProvider());
    }

    public static OrderedPullDispatcher start(DispatcherConfig config, MessageQueue queue) throws SetupException {
        return start(config, queue, Metrics.disabled());
    }

    /**
     * Stops fetching and closes the subscription. Returns once the fetch loop has exited.
     * Messages that are already being processed are not cancelled. Calling stop more than once has no effect.
     */
    public void stop() {
        stateLock.lock();
        try {
            if (state == DispatcherState.STOPPED) {
                return;
            }
            state = DispatcherState.STOPPED;
            closeQuietly(name, subscription);
        } finally {
            stateLock.unlock();
        }

        // wake the fetch loop from a blocking fetch, backoff or slot wait
        fetchLoopThread.interrupt();
        joinFetchLoop();
        log.info("[{}] Stopped dispatcher for subject '{}'", name, config.subject());
    }

    /**
     * Stops fetching and waits until all messages in flight have been processed.
     * @param drainTimeout Maximum time to wait for messages in flight
     * @return true if all messages in flight finished before the timeout elapsed
     */
    public boolean stop(Duration drainTimeout) {
        if (drainTimeout == null) throw new IllegalArgumentException("Drain timeout cannot be null");
        stop();
        try {
            var drained = admissionGate.awaitIdle(drainTimeout);
            if (!drained) {
                log.warn("[{}] {} messages still in flight after {}", name, admissionGate.inFlight(), drainTimeout);
            }
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for messages in flight", name);
            return false;
        }
    }

    /**
     * Stops the dispatcher, waits up to {@link DispatcherConfig#shutdownTimeout()} for messages in flight and shuts
     * down the processor threads. Messages still in flight after the timeout, including those waiting for their key
     * lock, are processed to completion with their deadline enforced.
     */
    @Override
    public void close() {
        var drained = stop(config.shutdownTimeout());
        processorExecutor.shutdown();
        if (drained || deadlineScheduler.isShutdown()) {
            deadlineScheduler.shutdown();
            return;
        }
        // processors still need the deadline scheduler, shut it down once the last one has finished
        try {
            deadlineScheduler.scheduleWithFixedDelay(this::shutdownDeadlineSchedulerWhenIdle,
                    IDLE_CHECK_INTERVAL.toMillis(), IDLE_CHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Deadline scheduler already shut down", name);
        }
    }

    private void shutdownDeadlineSchedulerWhenIdle() {
        if (admissionGate.inFlight() == 0) {
            log.debug("[{}] All messages in flight finished, shutting down deadline scheduler", name);
            deadlineScheduler.shutdown();
        }
    }

    public boolean isActive() {
        stateLock.lock();
        try {
            return state == DispatcherState.ACTIVE;
        } finally {
            stateLock.unlock();
        }
    }

    public DispatcherState getState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return Number of messages that are currently admitted for processing
     */
    public int inFlight() {
        return admissionGate.inFlight();
    }

    public String getName() {
        return name;
    }

    private void fetchLoop() {
        while (isActive()) {
            List<QueueMessage> batch;
            try {
                batch = subscription.fetch(config.batchSize(), config.maxWait());
            } catch (InterruptedException e) {
                break;
            } catch (FetchException | RuntimeException e) {
                if (!isActive()) {
                    break;
                }
                log.error("[{}] Failed to fetch messages for subject {}", name, config.subject(), e);
                metrics.incrementCounter(FETCH_ERRORS_COUNTER, "Number of failed fetches", "dispatcherName", name);
                if (!backoff()) {
                    break;
                }
                continue;
            }

            if (batch == null || batch.isEmpty()) {
                // no messages within max wait
                continue;
            }
            if (!dispatch(batch)) {
                break;
            }
        }
        log.debug("[{}] Fetch loop exited", name);
    }

    /**
     * @return false if the fetch loop has to exit
     */
    private boolean dispatch(List<QueueMessage> batch) {
        for (int i = 0; i < batch.size(); i++) {
            var message = batch.get(i);
            try {
                admissionGate.acquire();
            } catch (InterruptedException e) {
                releaseUndispatched(batch.subList(i, batch.size()));
                return false;
            }
            try {
                processorExecutor.execute(new MessageProcessor(message, config, keyLockRegistry, admissionGate,
                        deadlineScheduler, metrics));
            } catch (RejectedExecutionException e) {
                admissionGate.release();
                log.error("[{}] Processor executor rejected message on subject {}", name, message.subject(), e);
                releaseUndispatched(batch.subList(i, batch.size()));
                return isActive() && backoff();
            }
        }
        return true;
    }

    private void releaseUndispatched(List<QueueMessage> messages) {
        log.info("[{}] Returning {} undispatched messages to the queue", name, messages.size());
        for (var message : messages) {
            try {
                message.nack(config.keyExtractionNackDelay());
            } catch (AckException e) {
                log.warn("[{}] Failed to nack undispatched message on subject {}", name, message.subject(), e);
            }
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(config.fetchErrorBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }

    private void joinFetchLoop() {
        if (Thread.currentThread() == fetchLoopThread) {
            return;
        }
        // a fetch that ignores interrupts returns after max wait at the latest
        var joinTimeout = config.maxWait().plusSeconds(5);
        try {
            fetchLoopThread.join(joinTimeout.toMillis());
            if (fetchLoopThread.isAlive()) {
                log.warn("[{}] Fetch loop did not exit within {}", name, joinTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for the fetch loop to exit", name);
        }
    }

    private static void closeQuietly(String name, PullSubscription subscription) {
        try {
            subscription.close();
        } catch (DispatcherException | RuntimeException e) {
            log.warn("[{}] Error while closing subscription", name, e);
        }
    }

    // visible for tests
    KeyLockRegistry keyLockRegistry() {
        return keyLockRegistry;
    }

    // visible for tests
    ScheduledThreadPoolExecutor deadlineScheduler() {
        return deadlineScheduler;
    }
}
