package org.faultline.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * It is part of the public API. Every failure carries an error code and, where one exists,
 * the source position of the offending declaration.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final transient SourceInfo sourceInfo;
    private final String detail;

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = null;
        this.detail = message;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source information.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(sourceInfo != null ? String.format("%s at %s", message, sourceInfo) : message, null);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
        this.detail = message;
    }

    /**
     * @return The error code identifying the failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the offending declaration, or null if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The message without the appended source position.
     */
    public String getDetail() {
        return detail;
    }
}
