package org.pragmatica.ssr.error;

/**
 * Base of every failure raised by the search-and-replace engine.
 */
public abstract sealed class SsrException extends RuntimeException
    permits ParseException, PatternCompileException, MatchException, RewriteException {

    protected SsrException(String message) {
        super(message);
    }

    protected SsrException(String message, Throwable cause) {
        super(message, cause);
    }
}
