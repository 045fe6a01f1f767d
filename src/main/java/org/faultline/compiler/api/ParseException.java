package org.faultline.compiler.api;

/**
 * Thrown when the taxonomy source is not well-formed.
 */
public class ParseException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending declaration.
     */
    public ParseException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
