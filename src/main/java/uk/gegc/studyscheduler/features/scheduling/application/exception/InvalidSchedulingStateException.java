package uk.gegc.studyscheduler.features.scheduling.application.exception;

/**
 * Stored scheduling parameters that break the SM-2 invariants, e.g. a reviewed card with a
 * non-positive interval. Never produced by the scheduler itself.
 */
public class InvalidSchedulingStateException extends RuntimeException {

    public InvalidSchedulingStateException(String message) {
        super(message);
    }
}
