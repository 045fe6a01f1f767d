package org.faultline.compiler.api;

/**
 * Describes where a variant finds its primary source span at runtime.
 */
public sealed interface SpanRule permits SpanRule.FromField, SpanRule.Default {

    /**
     * The span is the value of the field carrying the span marker.
     * @param fieldName The field name; positional fields are named {@code _<index>}.
     * @param fieldIndex The zero-based position of the field.
     */
    record FromField(String fieldName, int fieldIndex) implements SpanRule {}

    /**
     * No source location is known; the empty span is used.
     */
    record Default() implements SpanRule {
        /** The single instance. */
        public static final Default INSTANCE = new Default();
    }
}
