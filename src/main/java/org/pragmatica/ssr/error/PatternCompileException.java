package org.pragmatica.ssr.error;

import java.util.Optional;

/**
 * A pattern or template is malformed, or refers to a metavariable that cannot be bound.
 * Raised while building matchers and searchers, before any file is processed.
 */
public final class PatternCompileException extends SsrException {
    private final Diagnostic diagnostic;

    public PatternCompileException(String message) {
        super(message);
        this.diagnostic = null;
    }

    public PatternCompileException(String message, String source, Diagnostic diagnostic) {
        super(message + "\n" + diagnostic.format(source, "<pattern>"));
        this.diagnostic = diagnostic;
    }

    public Optional<Diagnostic> diagnostic() {
        return Optional.ofNullable(diagnostic);
    }
}
