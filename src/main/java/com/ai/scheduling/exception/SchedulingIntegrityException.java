package com.ai.scheduling.exception;

/**
 * A booking or queue entry references a candidate or resource that does not exist.
 * Fatal for the single operation that hit it; never swallowed.
 */
public class SchedulingIntegrityException extends RuntimeException {

    public SchedulingIntegrityException(String message) {
        super(message);
    }
}
