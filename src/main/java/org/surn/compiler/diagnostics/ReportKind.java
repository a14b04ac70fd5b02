package org.surn.compiler.diagnostics;

/**
 * The severity of a {@link Report}.
 */
public enum ReportKind {
    ERROR("error"),
    WARNING("warning"),
    NOTICE("notice");

    private final String label;

    ReportKind(String label) {
        this.label = label;
    }

    /**
     * @return The lowercase name printed in report headers.
     */
    public String label() {
        return label;
    }
}
