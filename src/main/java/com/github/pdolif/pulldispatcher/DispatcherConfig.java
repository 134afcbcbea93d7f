package com.github.pdolif.pulldispatcher;

import java.time.Duration;

/**
 * Immutable configuration of an {@link OrderedPullDispatcher}. Use {@link #builder()} to create one.
 */
public final class DispatcherConfig {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_CONCURRENT = 25;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_KEY_EXTRACTION_NACK_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HANDLER_FAILURE_NACK_DELAY = Duration.ofSeconds(15);
    public static final Duration DEFAULT_FETCH_ERROR_BACKOFF = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final int MAX_DELIVERIES = 5;

    private final String name;
    private final String stream;
    private final String subject;
    private final String durableName;
    private final int batchSize;
    private final int maxConcurrent;
    private final Duration maxWait;
    private final MessageHandler handler;
    private final Duration handlerTimeout;
    private final Duration keyExtractionNackDelay;
    private final Duration handlerFailureNackDelay;
    private final Duration fetchErrorBackoff;
    private final Duration shutdownTimeout;

    private DispatcherConfig(Builder builder) {
        this.stream = builder.stream;
        this.subject = builder.subject;
        this.durableName = builder.durableName;
        this.name = (builder.name == null) ? builder.durableName : builder.name;
        this.batchSize = builder.batchSize;
        this.maxConcurrent = builder.maxConcurrent;
        this.maxWait = builder.maxWait;
        this.handler = builder.handler;
        this.handlerTimeout = builder.handlerTimeout;
        this.keyExtractionNackDelay = builder.keyExtractionNackDelay;
        this.handlerFailureNackDelay = builder.handlerFailureNackDelay;
        this.fetchErrorBackoff = builder.fetchErrorBackoff;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return Name used to identify the dispatcher in logs, metrics and thread names. Defaults to the durable name.
     */
    public String name() {
        return name;
    }

    public String stream() {
        return stream;
    }

    public String subject() {
        return subject;
    }

    public String durableName() {
        return durableName;
    }

    public int batchSize() {
        return batchSize;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Duration maxWait() {
        return maxWait;
    }

    public MessageHandler handler() {
        return handler;
    }

    public Duration handlerTimeout() {
        return handlerTimeout;
    }

    public Duration keyExtractionNackDelay() {
        return keyExtractionNackDelay;
    }

    public Duration handlerFailureNackDelay() {
        return handlerFailureNackDelay;
    }

    public Duration fetchErrorBackoff() {
        return fetchErrorBackoff;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{" +
                "name=" + name +
                ", stream=" + stream +
                ", subject=" + subject +
                ", durableName=" + durableName +
                ", batchSize=" + batchSize +
                ", maxConcurrent=" + maxConcurrent +
                ", maxWait=" + maxWait +
                ", handlerTimeout=" + handlerTimeout +
                '}';
    }

    static final Duration MAX_WAIT_LIMIT = Duration.ofMillis(Integer.MAX_VALUE);

    public static final class Builder {

        private String name;
        private String stream;
        private String subject;
        private String durableName;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private MessageHandler handler;
        private Duration handlerTimeout = DEFAULT_HANDLER_TIMEOUT;
        private Duration keyExtractionNackDelay = DEFAULT_KEY_EXTRACTION_NACK_DELAY;
        private Duration handlerFailureNackDelay = DEFAULT_HANDLER_FAILURE_NACK_DELAY;
        private Duration fetchErrorBackoff = DEFAULT_FETCH_ERROR_BACKOFF;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder stream(String stream) {
            this.stream = stream;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder durableName(String durableName) {
            this.durableName = durableName;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be greater than 0");
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            if (maxConcurrent <= 0) throw new IllegalArgumentException("Max concurrent must be greater than 0");
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            requirePositive(maxWait, "Max wait");
            // the batch receive timeout of the consumer is an int of milliseconds
            if (maxWait.compareTo(MAX_WAIT_LIMIT) > 0) {
                throw new IllegalArgumentException("Max wait cannot exceed " + MAX_WAIT_LIMIT);
            }
            this.maxWait = maxWait;
            return this;
        }

        public Builder handler(MessageHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder handlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = requirePositive(handlerTimeout, "Handler timeout");
            return this;
        }

        public Builder keyExtractionNackDelay(Duration keyExtractionNackDelay) {
            this.keyExtractionNackDelay = requireNonNegative(keyExtractionNackDelay, "Key extraction nack delay");
            return this;
        }

        public Builder handlerFailureNackDelay(Duration handlerFailureNackDelay) {
            this.handlerFailureNackDelay = requireNonNegative(handlerFailureNackDelay, "Handler failure nack delay");
            return this;
        }

        public Builder fetchErrorBackoff(Duration fetchErrorBackoff) {
            this.fetchErrorBackoff = requireNonNegative(fetchErrorBackoff, "Fetch error backoff");
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = requireNonNegative(shutdownTimeout, "Shutdown timeout");
            return this;
        }

        public DispatcherConfig build() {
            requireText(stream, "Stream");
            requireText(subject, "Subject");
            requireText(durableName, "Durable name");
            if (handler == null) throw new IllegalArgumentException("Handler cannot be null");
            return new DispatcherConfig(this);
        }

        private static void requireText(String value, String field) {
            if (value == null) throw new IllegalArgumentException(field + " cannot be null");
            if (value.isBlank()) throw new IllegalArgumentException(field + " cannot be blank");
        }

        private static Duration requirePositive(Duration value, String field) {
            if (value == null) throw new IllegalArgumentException(field + " cannot be null");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(field + " must be positive");
            }
            return value;
        }

        private static Duration requireNonNegative(Duration value, String field) {
            if (value == null) throw new IllegalArgumentException(field + " cannot be null");
            if (value.isNegative()) throw new IllegalArgumentException(field + " cannot be negative");
            return value;
        }
    }
}
