package org.faultline.compiler.api;

/**
 * Thrown when an attribute has an unknown key or a malformed value.
 */
public class AttributeException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending declaration.
     */
    public AttributeException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
