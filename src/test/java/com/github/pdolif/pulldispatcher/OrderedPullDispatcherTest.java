package com.github.pdolif.pulldispatcher;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

public class OrderedPullDispatcherTest {

    private final Duration shortDelay = Duration.ofSeconds(5);
    private final Duration longDelay = Duration.ofSeconds(15);
    private FakeMessageQueue queue;
    private SimpleMeterRegistry meterRegistry;
    private OrderedPullDispatcher dispatcher;

    @BeforeEach
    public void setup() {
        queue = new FakeMessageQueue();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    public void close() {
        if (dispatcher != null) dispatcher.close();
    }

    @Test
    public void registerDurableConsumerOnStart() throws SetupException {
        dispatcher = start(configBuilder(new RecordingHandler()).batchSize(7).build());

        assertThat(dispatcher.isActive()).isTrue();
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.ACTIVE);
        assertThat(queue.subscribedWith()).isEqualTo(new ConsumerSettings("public/default", "orders",
                "order-processor", 7, Duration.ofMillis(50), 5));
    }

    @Test
    public void failToStartWhenConsumerCannotBeRegistered() {
        queue.failSubscribeWith(new SetupException("stream not found"));

        assertThatThrownBy(() -> start(configBuilder(new RecordingHandler()).build()))
                .isInstanceOf(SetupException.class)
                .hasMessage("stream not found");
        assertThat(queue.fetchCount()).isZero();
    }

    @Test
    public void requireNonNullArguments() {
        var config = configBuilder(new RecordingHandler()).build();
        assertThrows(IllegalArgumentException.class, () -> OrderedPullDispatcher.start(null, queue));
        assertThrows(IllegalArgumentException.class, () -> OrderedPullDispatcher.start(config, null));
        assertThrows(IllegalArgumentException.class, () ->
                OrderedPullDispatcher.start(config, queue, null));
        assertThrows(IllegalArgumentException.class, () ->
                OrderedPullDispatcher.start(config, queue, Metrics.disabled(), null));
    }

    @Test
    public void closeSubscriptionWhenExecutorServiceProviderFails() {
        var config = configBuilder(new RecordingHandler()).build();

        assertThrows(IllegalArgumentException.class, () ->
                OrderedPullDispatcher.start(config, queue, Metrics.disabled(), dispatcherName -> null));
        assertThat(queue.isClosed()).isTrue();
    }

    @Test
    public void processSameKeyMessagesOfOneBatchSequentially() throws SetupException {
        // given a handler that sleeps 100ms for each message
        var sleepDuration = 100;
        var handler = new RecordingHandler(sleepDuration);
        // given a batch of two messages with the same ordering key
        var message1 = FakeMessage.withKey("message1", "A");
        var message2 = FakeMessage.withKey("message2", "A");
        queue.batch(message1, message2);

        // when dispatching with batch size 2 and one concurrent message
        long startTime = System.currentTimeMillis();
        dispatcher = start(configBuilder(handler).batchSize(2).maxConcurrent(1).build());

        await().pollInterval(10, MILLISECONDS).until(() -> message1.ackCount() == 1 && message2.ackCount() == 1);
        long endTime = System.currentTimeMillis();
        // then the handler is called sequentially
        assertThat(endTime - startTime).isGreaterThanOrEqualTo(sleepDuration * 2);
        assertThat(handler.maxActive()).isEqualTo(1);
    }

    @Test
    public void neverProcessSameKeyMessagesConcurrently() throws SetupException {
        // given many messages with two ordering keys and plenty of concurrency
        var handler = new RecordingHandler(5);
        var messages = new ArrayList<FakeMessage>();
        for (int batch = 0; batch < 5; batch++) {
            var batchMessages = new FakeMessage[10];
            for (int i = 0; i < 10; i++) {
                var message = FakeMessage.withKey("message" + batch + "-" + i, (i % 2 == 0) ? "A" : "B");
                batchMessages[i] = message;
                messages.add(message);
            }
            queue.batch(batchMessages);
        }

        // when dispatching them
        dispatcher = start(configBuilder(handler).maxConcurrent(20).build());

        // then all messages are processed and no key is ever processed concurrently
        await().atMost(10, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS)
                .until(() -> messages.stream().allMatch(m -> m.ackCount() == 1));
        assertThat(handler.maxActivePerKey()).isEqualTo(1);
        assertThat(handler.maxActive()).isLessThanOrEqualTo(2);
    }

    @Test
    public void processDifferentKeysConcurrently() throws SetupException {
        // given a handler that waits until both messages are being processed
        var bothStarted = new CountDownLatch(2);
        var overlapped = new AtomicBoolean(true);
        var handler = new LatchHandler(bothStarted, overlapped);
        var messageA = FakeMessage.withKey("message1", "A");
        var messageB = FakeMessage.withKey("message2", "B");
        queue.batch(messageA, messageB);

        // when dispatching with two concurrent messages
        dispatcher = start(configBuilder(handler).maxConcurrent(2).build());

        // then both handler calls overlap
        await().pollInterval(10, MILLISECONDS).until(() -> messageA.ackCount() == 1 && messageB.ackCount() == 1);
        assertThat(overlapped).isTrue();
    }

    @Test
    public void neverExceedMaxConcurrentMessages() throws SetupException {
        // given far more messages with unique keys than the concurrency limit
        var handler = new RecordingHandler(20);
        var messages = new ArrayList<FakeMessage>();
        for (int batch = 0; batch < 6; batch++) {
            var batchMessages = new FakeMessage[10];
            for (int i = 0; i < 10; i++) {
                batchMessages[i] = FakeMessage.withKey("message" + batch + "-" + i, "key" + batch + "-" + i);
                messages.add(batchMessages[i]);
            }
            queue.batch(batchMessages);
        }

        // when dispatching with a limit of 3 concurrent messages
        dispatcher = start(configBuilder(handler).maxConcurrent(3).build());

        // then at most 3 handler invocations run at the same time
        await().atMost(10, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS)
                .until(() -> messages.stream().allMatch(m -> m.ackCount() == 1));
        assertThat(handler.maxActive()).isLessThanOrEqualTo(3);
        assertThat(handler.maxActive()).isGreaterThan(1);
    }

    @Test
    public void nackMessageWhoseOrderingKeyCannotBeDerived() throws SetupException {
        var handler = new RecordingHandler() {
            @Override
            public String orderingKey(QueueMessage message) {
                throw new IllegalArgumentException("malformed message");
            }
        };
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);

        dispatcher = start(configBuilder(handler).build());

        await().pollInterval(10, MILLISECONDS).until(message::isFinalized);
        assertThat(message.nacks()).containsExactly(shortDelay);
        assertThat(message.ackCount()).isZero();
        assertThat(handler.processCalls()).isZero();
    }

    @Test
    public void ackSuccessfullyProcessedMessageExactlyOnce() throws SetupException {
        var handler = new RecordingHandler();
        var message = FakeMessage.withoutKey("message1");
        queue.batch(message);

        dispatcher = start(configBuilder(handler).build());

        await().pollInterval(10, MILLISECONDS).until(message::isFinalized);
        dispatcher.stop(Duration.ofSeconds(1));
        assertThat(message.ackCount()).isEqualTo(1);
        assertThat(message.nacks()).isEmpty();
        assertThat(handler.processed()).containsExactly("message1");
    }

    @Test
    public void nackFailedMessageWithLongDelay() throws SetupException {
        var handler = new RecordingHandler() {
            @Override
            public void process(QueueMessage message, Deadline deadline) throws Exception {
                throw new Exception("downstream unavailable");
            }
        };
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);

        dispatcher = start(configBuilder(handler).build());

        await().pollInterval(10, MILLISECONDS).until(message::isFinalized);
        assertThat(message.nacks()).containsExactly(longDelay);
        assertThat(message.ackCount()).isZero();
    }

    @Test
    public void nackMessageExceedingDeadlineWithLongDelay() throws SetupException {
        var handler = new RecordingHandler(10_000);
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);

        dispatcher = start(configBuilder(handler).handlerTimeout(Duration.ofMillis(100)).build());

        await().atMost(2, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS).until(message::isFinalized);
        assertThat(message.nacks()).containsExactly(longDelay);
        assertThat(message.ackCount()).isZero();
    }

    @Test
    public void retrySilentlyAfterFetchTimeouts() throws SetupException {
        // given a queue that times out three times before returning a message
        var handler = new RecordingHandler();
        var message = FakeMessage.withKey("message1", "A");
        queue.timeout().timeout().timeout().batch(message);

        dispatcher = start(configBuilder(handler).build(), Metrics.with(meterRegistry));

        // then the message is processed normally after three silent retries
        await().pollInterval(10, MILLISECONDS).until(() -> message.ackCount() == 1);
        assertThat(queue.fetchCount()).isGreaterThanOrEqualTo(4);
        assertThat(meterRegistry.find(OrderedPullDispatcher.FETCH_ERRORS_COUNTER).counter()).isNull();
    }

    @Test
    public void backOffAndRetryAfterFetchError() throws SetupException {
        // given a queue that fails once before returning a message
        var handler = new RecordingHandler();
        var message = FakeMessage.withKey("message1", "A");
        queue.fetchError("connection reset").batch(message);

        long startTime = System.currentTimeMillis();
        dispatcher = start(configBuilder(handler).fetchErrorBackoff(Duration.ofMillis(200)).build(),
                Metrics.with(meterRegistry));

        // then the fetch is retried after the backoff and the message is processed
        await().pollInterval(10, MILLISECONDS).until(() -> message.ackCount() == 1);
        assertThat(System.currentTimeMillis() - startTime).isGreaterThanOrEqualTo(200);
        assertThat(dispatcher.isActive()).isTrue();
        var fetchErrors = meterRegistry.get(OrderedPullDispatcher.FETCH_ERRORS_COUNTER)
                .tags("dispatcherName", "dispatcher1")
                .counter()
                .count();
        assertThat(fetchErrors).isEqualTo(1);
    }

    @Test
    public void keepFetchingAfterUnexpectedFetchFailure() throws SetupException {
        // given a queue whose first fetch fails with an unchecked exception
        var handler = new RecordingHandler();
        var message = FakeMessage.withKey("message1", "A");
        queue.unexpectedFailure(new IllegalStateException("consumer in bad state")).batch(message);

        dispatcher = start(configBuilder(handler).fetchErrorBackoff(Duration.ofMillis(50)).build(),
                Metrics.with(meterRegistry));

        // then the failure is treated like a fetch error and the next fetch delivers the message
        await().pollInterval(10, MILLISECONDS).until(() -> message.ackCount() == 1);
        assertThat(dispatcher.isActive()).isTrue();
        assertThat(queue.fetchCount()).isGreaterThanOrEqualTo(2);
        var fetchErrors = meterRegistry.get(OrderedPullDispatcher.FETCH_ERRORS_COUNTER)
                .tags("dispatcherName", "dispatcher1")
                .counter()
                .count();
        assertThat(fetchErrors).isEqualTo(1);
    }

    @Test
    public void keepFetchingAfterProcessorExecutorRejectsMessage() throws SetupException {
        // given an executor that rejects the first message only
        var executorService = new RejectingOnceExecutorService();
        var rejected = FakeMessage.withKey("message1", "A");
        var next = FakeMessage.withKey("message2", "B");
        queue.batch(rejected).batch(next);

        dispatcher = OrderedPullDispatcher.start(configBuilder(new RecordingHandler())
                        .fetchErrorBackoff(Duration.ofMillis(50)).build(),
                queue, Metrics.disabled(), dispatcherName -> executorService);

        // then the rejected message is returned to the queue and the following batch is processed
        await().pollInterval(10, MILLISECONDS).until(() -> next.ackCount() == 1);
        assertThat(rejected.nacks()).containsExactly(shortDelay);
        assertThat(rejected.ackCount()).isZero();
        assertThat(dispatcher.isActive()).isTrue();
        assertThat(dispatcher.inFlight()).isZero();
    }

    @Test
    public void processMessagesWaitingForKeyLockAfterCloseTimeout() throws SetupException {
        // given two messages with the same key and a handler slower than the shutdown timeout
        var handler = new RecordingHandler(500);
        var message1 = FakeMessage.withKey("message1", "A");
        var message2 = FakeMessage.withKey("message2", "A");
        queue.batch(message1, message2);
        dispatcher = start(configBuilder(handler).shutdownTimeout(Duration.ofMillis(100)).build());
        await().pollInterval(5, MILLISECONDS).until(() -> dispatcher.inFlight() == 2);

        // when closing while one of them waits for the key lock
        dispatcher.close();

        // then both are processed and acked exactly once
        await().atMost(5, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS)
                .until(() -> message1.isFinalized() && message2.isFinalized());
        assertThat(message1.ackCount()).isEqualTo(1);
        assertThat(message2.ackCount()).isEqualTo(1);
        assertThat(message1.nacks()).isEmpty();
        assertThat(message2.nacks()).isEmpty();
        assertThat(handler.processCalls()).isEqualTo(2);
        await().pollInterval(10, MILLISECONDS).until(() -> dispatcher.deadlineScheduler().isShutdown());
    }

    @Test
    public void notRetainCancelledDeadlineWatchdogs() throws SetupException {
        // given many messages that finish long before the handler timeout
        var messages = new ArrayList<FakeMessage>();
        for (int batch = 0; batch < 10; batch++) {
            var batchMessages = new FakeMessage[10];
            for (int i = 0; i < 10; i++) {
                batchMessages[i] = FakeMessage.withKey("message" + batch + "-" + i, "key" + i);
                messages.add(batchMessages[i]);
            }
            queue.batch(batchMessages);
        }

        dispatcher = start(configBuilder(new RecordingHandler()).handlerTimeout(Duration.ofMinutes(5)).build());

        // then no watchdog stays queued once its message is processed
        await().atMost(10, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS)
                .until(() -> messages.stream().allMatch(m -> m.ackCount() == 1));
        await().pollInterval(10, MILLISECONDS).until(() -> dispatcher.inFlight() == 0);
        assertThat(dispatcher.deadlineScheduler().getQueue()).isEmpty();
    }

    @Test
    public void countFetchCallsAfterStop() throws Exception {
        // given a stopped dispatcher, a fetch on its closed subscription is still counted
        dispatcher = start(configBuilder(new RecordingHandler()).build());
        dispatcher.stop();
        int fetchCountAfterStop = queue.fetchCount();

        var subscription = queue.subscribe(ConsumerSettings.from(configBuilder(new RecordingHandler()).build()));
        subscription.close();
        assertThrows(FetchException.class, () -> subscription.fetch(1, Duration.ofMillis(10)));

        assertThat(queue.fetchCount()).isEqualTo(fetchCountAfterStop + 1);
    }

    @Test
    public void notFetchAfterStop() throws Exception {
        dispatcher = start(configBuilder(new RecordingHandler()).build());
        await().pollInterval(10, MILLISECONDS).until(() -> queue.fetchCount() >= 2);

        dispatcher.stop();
        int fetchCountAfterStop = queue.fetchCount();
        Thread.sleep(200);

        assertThat(queue.fetchCount()).isEqualTo(fetchCountAfterStop);
        assertThat(queue.isClosed()).isTrue();
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.STOPPED);
    }

    @Test
    public void allowMultipleStopCalls() throws SetupException {
        dispatcher = start(configBuilder(new RecordingHandler()).build());

        dispatcher.stop();
        dispatcher.stop();
        dispatcher.close();

        assertThat(dispatcher.isActive()).isFalse();
    }

    @Test
    public void letMessagesInFlightFinishAfterStop() throws SetupException {
        var handler = new RecordingHandler(300);
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);
        dispatcher = start(configBuilder(handler).build());
        await().pollInterval(5, MILLISECONDS).until(() -> dispatcher.inFlight() == 1);

        var drained = dispatcher.stop(Duration.ofSeconds(5));

        assertThat(drained).isTrue();
        assertThat(message.ackCount()).isEqualTo(1);
        assertThat(dispatcher.inFlight()).isZero();
    }

    @Test
    public void reportUndrainedMessagesAfterDrainTimeout() throws SetupException {
        var handler = new RecordingHandler(1_000);
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);
        dispatcher = start(configBuilder(handler).build());
        await().pollInterval(5, MILLISECONDS).until(() -> dispatcher.inFlight() == 1);

        var drained = dispatcher.stop(Duration.ofMillis(50));

        assertThat(drained).isFalse();
        await().atMost(3, TimeUnit.SECONDS).pollInterval(10, MILLISECONDS).until(() -> message.ackCount() == 1);
    }

    @Test
    public void nackFetchedMessagesThatWereNotDispatchedBeforeStop() throws SetupException {
        // given one slot that is taken by a slow message
        var handler = new RecordingHandler(1_000);
        var slow = FakeMessage.withKey("message1", "A");
        var waiting = FakeMessage.withKey("message2", "B");
        queue.batch(slow, waiting);
        dispatcher = start(configBuilder(handler).maxConcurrent(1).build());
        await().pollInterval(5, MILLISECONDS).until(() -> dispatcher.inFlight() == 1);

        // when stopping while the fetch loop waits for a slot
        dispatcher.stop();

        // then the waiting message is returned to the queue
        assertThat(waiting.nacks()).containsExactly(shortDelay);
        assertThat(handler.processed()).doesNotContain("message2");
    }

    @Test
    public void releaseSlotWhenFinalizingFailsUnexpectedly() throws SetupException {
        var handler = new RecordingHandler();
        var broken = FakeMessage.withKey("message1", "A").failAckWith(new IllegalStateException("broken"));
        var next = FakeMessage.withKey("message2", "A");
        queue.batch(broken, next);

        dispatcher = start(configBuilder(handler).maxConcurrent(1).build());

        await().pollInterval(10, MILLISECONDS).until(() -> next.ackCount() == 1);
        assertThat(handler.processed()).containsExactly("message1", "message2");
    }

    @Test
    public void removeKeyLocksOnceMessagesAreProcessed() throws SetupException {
        var handler = new RecordingHandler(10);
        var messages = List.of(FakeMessage.withKey("message1", "A"), FakeMessage.withKey("message2", "B"),
                FakeMessage.withKey("message3", "C"));
        queue.batch(messages.toArray(new FakeMessage[0]));

        dispatcher = start(configBuilder(handler).build(), Metrics.with(meterRegistry));

        await().pollInterval(10, MILLISECONDS).until(() -> messages.stream().allMatch(m -> m.ackCount() == 1));
        await().pollInterval(10, MILLISECONDS).until(() -> dispatcher.keyLockRegistry().size() == 0);
        var keyLocks = meterRegistry.get("pull.dispatcher.key.locks.count")
                .tags("dispatcherName", "dispatcher1")
                .gauge()
                .value();
        assertThat(keyLocks).isZero();
    }

    @Test
    public void countProcessedMessagesByOutcome() throws SetupException {
        var handler = new RecordingHandler() {
            @Override
            public void process(QueueMessage message, Deadline deadline) throws Exception {
                if (new String(message.payload()).equals("bad")) {
                    throw new Exception("rejected");
                }
            }
        };
        var good = FakeMessage.withKey("good", "A");
        var bad = FakeMessage.withKey("bad", "B");
        queue.batch(good, bad);

        dispatcher = start(configBuilder(handler).build(), Metrics.with(meterRegistry));

        await().pollInterval(10, MILLISECONDS).until(() -> good.isFinalized() && bad.isFinalized());
        await().pollInterval(10, MILLISECONDS)
                .until(() -> processedCount("acked") == 1 && processedCount("nacked_handler_failed") == 1);
        assertThat(processedCount("nacked_key_extraction_failed")).isZero();
    }

    @Test
    public void useProvidedExecutorServiceForProcessors() throws SetupException {
        ExecutorService executorService = spy(Executors.newCachedThreadPool());
        ExecutorServiceProvider executorServiceProviderMock = mock(ExecutorServiceProvider.class);
        when(executorServiceProviderMock.createProcessorExecutorService("dispatcher1")).thenReturn(executorService);
        var message = FakeMessage.withKey("message1", "A");
        queue.batch(message);

        dispatcher = OrderedPullDispatcher.start(configBuilder(new RecordingHandler()).build(), queue,
                Metrics.disabled(), executorServiceProviderMock);

        await().pollInterval(10, MILLISECONDS).until(() -> message.ackCount() == 1);
        verify(executorService).execute(any(MessageProcessor.class));
        dispatcher.close();
        verify(executorService).shutdown();
    }

    private double processedCount(String outcome) {
        var counter = meterRegistry.find(MessageProcessor.PROCESSED_COUNTER)
                .tags("dispatcherName", "dispatcher1", "outcome", outcome)
                .counter();
        return (counter == null) ? 0 : counter.count();
    }

    private OrderedPullDispatcher start(DispatcherConfig config) throws SetupException {
        return start(config, Metrics.disabled());
    }

    private OrderedPullDispatcher start(DispatcherConfig config, Metrics metrics) throws SetupException {
        return OrderedPullDispatcher.start(config, queue, metrics);
    }

    private DispatcherConfig.Builder configBuilder(MessageHandler handler) {
        return DispatcherConfig.builder()
                .name("dispatcher1")
                .stream("public/default")
                .subject("orders")
                .durableName("order-processor")
                .handler(handler)
                .maxWait(Duration.ofMillis(50))
                .keyExtractionNackDelay(shortDelay)
                .handlerFailureNackDelay(longDelay)
                .shutdownTimeout(Duration.ofSeconds(2));
    }

    private static class RejectingOnceExecutorService extends ThreadPoolExecutor {

        private final AtomicBoolean rejected = new AtomicBoolean(false);

        private RejectingOnceExecutorService() {
            super(0, Integer.MAX_VALUE, 60, TimeUnit.SECONDS, new SynchronousQueue<>());
        }

        @Override
        public void execute(Runnable command) {
            if (rejected.compareAndSet(false, true)) {
                throw new RejectedExecutionException("saturated");
            }
            super.execute(command);
        }
    }

    private static class LatchHandler extends RecordingHandler {

        private final CountDownLatch bothStarted;
        private final AtomicBoolean overlapped;

        private LatchHandler(CountDownLatch bothStarted, AtomicBoolean overlapped) {
            this.bothStarted = bothStarted;
            this.overlapped = overlapped;
        }

        @Override
        public void process(QueueMessage message, Deadline deadline) throws Exception {
            bothStarted.countDown();
            if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                overlapped.set(false);
            }
        }
    }
}
