package org.pragmatica.ssr.error;

/**
 * The same metavariable was bound twice with different conflict or merge policies.
 */
public final class PolicyMismatchException extends MatchException {
    private final String name;

    public PolicyMismatchException(String name, String first, String second) {
        super("Conflicting bind policies for metavariable '" + name + "': " + first + " vs " + second);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
