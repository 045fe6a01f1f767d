package org.faultline.runtime;

/**
 * What every value of a compiled error type can tell about itself.
 */
public interface ErrorDiagnostic {

    /**
     * @return The severity of the variant.
     */
    Severity kind();

    /**
     * @return The concatenated number fragments, e.g. {@code "01"}.
     */
    String numericCode();

    /**
     * @return The display code, e.g. {@code "E01"}.
     */
    String code();

    /**
     * @return The source location of the problem, or {@link SimpleSpan#EMPTY} if none is known.
     */
    Span primarySpan();

    /**
     * @return The message rendered with this value's fields.
     */
    String primaryMessage();

    /**
     * @return The label rendered with this value's fields; the message when no label was declared.
     */
    String primaryLabel();
}
