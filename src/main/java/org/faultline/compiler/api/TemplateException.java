package org.faultline.compiler.api;

/**
 * Thrown when a message or label template does not fit the field shape of its variant.
 */
public class TemplateException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending declaration.
     */
    public TemplateException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
