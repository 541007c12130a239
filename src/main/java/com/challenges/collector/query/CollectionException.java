package com.challenges.collector.query;

/**
 * Fatal failure while walking input records. Aborts the whole collect call.
 * Deliberately carries no traversal path.
 */
public class CollectionException extends RuntimeException {
    public CollectionException(String message) {
        super(message);
    }
}
