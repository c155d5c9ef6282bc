package org.pragmatica.ssr.error;

/**
 * A rendered replacement did not re-parse or re-verify. Only that substitution is discarded.
 */
public final class RewriteException extends SsrException {

    public RewriteException(String message) {
        super(message);
    }

    public RewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
