package org.faultline.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexer & Parser Errors
    /** A character that is not part of the taxonomy language. */
    UNEXPECTED_CHARACTER,
    /** A string literal was not closed before the end of the line or source. */
    UNTERMINATED_STRING,
    /** A string literal contains an unsupported escape sequence. */
    INVALID_ESCAPE,
    /** A token other than the expected one was found. */
    UNEXPECTED_TOKEN,
    /** More than one field of a variant carries the span marker. */
    DUPLICATE_SPAN_MARKER,
    /** A field attribute other than the span marker was used. */
    UNKNOWN_FIELD_ATTRIBUTE,
    // endregion

    // region Attribute Errors
    /** An attribute key that the compiler does not recognize. */
    UNKNOWN_ATTRIBUTE_KEY,
    /** A kind literal other than Error or Warn. */
    INVALID_KIND,
    /** A number fragment that is not made of ASCII digits. */
    INVALID_NUMBER,
    /** A valued attribute was written without a value. */
    MISSING_ATTRIBUTE_VALUE,
    /** A flag attribute was given a value. */
    UNEXPECTED_ATTRIBUTE_VALUE,
    /** A string attribute was given a literal of another type. */
    INVALID_ATTRIBUTE_VALUE,
    // endregion

    // region Template Errors
    /** A placeholder refers to a positional field that does not exist. */
    PLACEHOLDER_INDEX_OUT_OF_RANGE,
    /** A placeholder refers to a named field that does not exist. */
    UNKNOWN_PLACEHOLDER_FIELD,
    /** A placeholder kind does not fit the field shape of the variant. */
    PLACEHOLDER_SHAPE_MISMATCH,
    /** A placeholder is not closed, or a closing brace has no opening one. */
    UNBALANCED_BRACES,
    /** A placeholder reference could not be parsed. */
    MALFORMED_PLACEHOLDER,
    // endregion

    // region Emission Errors
    /** A variant has no message, neither its own nor an inherited one. */
    MISSING_MESSAGE,
    /** A nested variant does not have exactly one field. */
    NESTED_VARIANT_FIELD_COUNT,
    /** Two variants share the same identifier. */
    DUPLICATE_IDENTIFIER,
    /** Two variants share the same code and duplicates are rejected. */
    DUPLICATE_CODE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
