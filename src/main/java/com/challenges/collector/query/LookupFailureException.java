package com.challenges.collector.query;

/**
 * A selected key or index is absent from the input.
 */
public class LookupFailureException extends CollectionException {
    private final Object key;

    public LookupFailureException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
