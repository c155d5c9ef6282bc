package org.pragmatica.ssr.error;

/**
 * A matcher was misused or misconfigured, e.g. an error bind policy fired. Aborts only the current
 * top-level match attempt.
 */
public sealed class MatchException extends SsrException permits PolicyMismatchException {

    public MatchException(String message) {
        super(message);
    }
}
