package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.api.SourceInfo;

/**
 * A field of a variant.
 *
 * @param name The field name, or null for a positional field.
 * @param type The declared type as written.
 * @param spanMarked Whether the field carries the span marker.
 * @param sourceInfo The position of the field.
 */
public record FieldNode(
        String name,
        String type,
        boolean spanMarked,
        SourceInfo sourceInfo
) {}
