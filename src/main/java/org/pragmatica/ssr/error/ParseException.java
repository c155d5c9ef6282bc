package org.pragmatica.ssr.error;

/**
 * Input text does not parse as the requested kind of Java fragment. Callers skip the file or fragment.
 */
public final class ParseException extends SsrException {
    private final String path;
    private final String source;
    private final Diagnostic diagnostic;

    public ParseException(String path, String source, Diagnostic diagnostic) {
        super(diagnostic.formatSimple(path));
        this.path = path;
        this.source = source;
        this.diagnostic = diagnostic;
    }

    public String path() {
        return path;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    /**
     * The diagnostic rendered against the text that failed to parse.
     */
    public String formatted() {
        return diagnostic.format(source, path);
    }
}
