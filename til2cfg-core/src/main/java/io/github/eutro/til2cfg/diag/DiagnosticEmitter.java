package io.github.eutro.til2cfg.diag;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Reports problems in the program being lowered, one line per report.
 */
public class DiagnosticEmitter {
    private final Appendable out;
    private int errorCount;
    private int warningCount;

    public DiagnosticEmitter() {
        this(System.err);
    }

    public DiagnosticEmitter(Appendable out) {
        this.out = out;
    }

    public void error(String format, Object... args) {
        errorCount++;
        emit("error", String.format(format, args));
    }

    public void warning(String format, Object... args) {
        warningCount++;
        emit("warning", String.format(format, args));
    }

    private void emit(String severity, String message) {
        try {
            out.append(severity).append(": ").append(message).append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getWarningCount() {
        return warningCount;
    }
}
