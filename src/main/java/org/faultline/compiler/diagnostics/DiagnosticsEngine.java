package org.faultline.compiler.diagnostics;

import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur during the compilation of a taxonomy.
 * <p>
 * This decouples reporting from the compiler phases. Errors are fatal, so at most one
 * error is recorded per compilation; warnings accumulate.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records the failure carried by a compilation exception.
     *
     * @param exception The exception that ended the compilation.
     */
    public void reportError(CompilationException exception) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, exception.getErrorCode(),
                exception.getDetail(), exception.getSourceInfo()));
    }

    /**
     * Reports a warning.
     *
     * @param code       The code identifying the condition.
     * @param message    The warning message.
     * @param sourceInfo The position the warning refers to.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, sourceInfo));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The warnings reported so far, in order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Forgets all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
