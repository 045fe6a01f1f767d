package org.faultline.compiler.api;

import java.util.List;

/**
 * A message or label template split into literal text and validated placeholders.
 *
 * @param source The template text exactly as written.
 * @param segments The segments in order of appearance.
 * @param sourceInfo The position of the template literal.
 */
public record CompiledTemplate(String source, List<Segment> segments, SourceInfo sourceInfo) {

    public CompiledTemplate {
        segments = List.copyOf(segments);
    }

    /**
     * @return The field references of all placeholders, in order of appearance.
     */
    public List<FieldRef> referencedFields() {
        return segments.stream()
                .filter(Placeholder.class::isInstance)
                .map(s -> ((Placeholder) s).field())
                .toList();
    }

    /**
     * A part of a template.
     */
    public sealed interface Segment permits Literal, Placeholder {}

    /**
     * Text copied to the output unchanged. Escaped braces are already collapsed.
     * @param text The literal text.
     */
    public record Literal(String text) implements Segment {}

    /**
     * A slot filled with a field value.
     * @param field The field the value is taken from.
     * @param formatSpec The text after the colon, or an empty string.
     */
    public record Placeholder(FieldRef field, String formatSpec) implements Segment {}

    /**
     * A reference from a placeholder to a field of the variant.
     */
    public sealed interface FieldRef permits Positional, Named {}

    /**
     * @param index The zero-based field position.
     */
    public record Positional(int index) implements FieldRef {}

    /**
     * @param name The field name.
     */
    public record Named(String name) implements FieldRef {}
}
