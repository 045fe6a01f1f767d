package org.faultline.compiler.api;

import org.faultline.runtime.Severity;

import java.util.List;

/**
 * The compiled, runtime-usable description of one variant of a taxonomy.
 *
 * @param identifier The variant name.
 * @param fieldShape The field layout, with the span marker stripped.
 * @param fieldTypes The declared field types as written, in field order.
 * @param severity The resolved severity.
 * @param numericCode The concatenated number fragments from the root down to the variant.
 * @param code The display code: severity marker followed by the numeric code.
 * @param message The compiled message template.
 * @param label The compiled label template; the message template when no label was set.
 * @param spanRule Where the primary span comes from.
 * @param nested Whether the single field of this variant is itself a diagnostic.
 * @param hostAttributes Attributes not addressed to the compiler, kept verbatim.
 * @param sourceInfo The position of the variant identifier.
 */
public record VariantDescriptor(
        String identifier,
        FieldShape fieldShape,
        List<String> fieldTypes,
        Severity severity,
        String numericCode,
        String code,
        CompiledTemplate message,
        CompiledTemplate label,
        SpanRule spanRule,
        boolean nested,
        List<String> hostAttributes,
        SourceInfo sourceInfo
) {
    public VariantDescriptor {
        fieldTypes = List.copyOf(fieldTypes);
        hostAttributes = List.copyOf(hostAttributes);
    }

    /**
     * @return The one-line documentation of this variant, e.g. {@code `E01`: File {path} not found.}
     */
    public String summary() {
        return "`" + code + "`: " + message.source();
    }

    /**
     * @return The alias under which the variant can be looked up in documentation, i.e. its code.
     */
    public String alias() {
        return code;
    }
}
