package uk.gegc.docgen.shared.http;

import java.io.InterruptedIOException;

/**
 * Thrown when a retry sequence is abandoned because its caller cancelled it or the thread was interrupted.
 */
public class RetryCancelledException extends InterruptedIOException {

    private final int attemptsMade;

    public RetryCancelledException(String message, int attemptsMade) {
        super(message);
        this.attemptsMade = attemptsMade;
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }
}
