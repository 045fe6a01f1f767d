package org.faultline.compiler.frontend.parser.ast;

/**
 * The field of a variant that carries the span marker.
 *
 * @param name The field name; positional fields are named {@code _<index>}.
 * @param index The zero-based position of the field.
 */
public record SpanField(String name, int index) {}
