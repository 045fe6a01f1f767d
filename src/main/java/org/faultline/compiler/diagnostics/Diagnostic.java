package org.faultline.compiler.diagnostics;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning)
 * produced while compiling a taxonomy.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or null for diagnostics without one.
 * @param message The diagnostic message.
 * @param sourceInfo The position the diagnostic refers to, or null.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceInfo sourceInfo
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        String where = sourceInfo != null ? sourceInfo.toString() : "<unknown>";
        return String.format("[%s] %s: %s", type, where, message);
    }
}
