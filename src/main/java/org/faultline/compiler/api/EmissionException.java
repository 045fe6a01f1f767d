package org.faultline.compiler.api;

/**
 * Thrown when a resolved variant cannot be turned into a descriptor.
 */
public class EmissionException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending declaration.
     */
    public EmissionException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
