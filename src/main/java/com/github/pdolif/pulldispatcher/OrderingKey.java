package com.github.pdolif.pulldispatcher;

/**
 * Ordering key of a message as derived by a {@link MessageHandler}.
 * Messages with the same non-empty ordering key are processed one at a time.
 * An empty key means the message has no ordering constraint.
 * @param value Ordering key, never null
 */
public record OrderingKey(String value) {

    private static final OrderingKey NONE = new OrderingKey("");

    public OrderingKey {
        if (value == null) {
            value = "";
        }
    }

    /**
     * @param value Ordering key as returned by a handler, may be null or empty
     * @return Ordering key for the given value
     */
    public static OrderingKey of(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        return new OrderingKey(value);
    }

    /**
     * @return Ordering key that imposes no ordering constraint
     */
    public static OrderingKey none() {
        return NONE;
    }

    /**
     * @return true if this key imposes no ordering constraint
     */
    public boolean isNone() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return "OrderingKey{" +
                "key=" + value +
                '}';
    }
}
