package org.faultline.runtime;

import org.faultline.compiler.api.CompiledTemplate;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SpanRule;
import org.faultline.compiler.api.VariantDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A value of a materialized error type: a variant together with its field values.
 * Messages and labels are rendered on each call.
 */
public final class ErrorInstance implements ErrorDiagnostic {

    private final ErrorVariant variant;
    private final List<Object> values;

    ErrorInstance(ErrorVariant variant, List<Object> values) {
        this.variant = variant;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * @return The variant of this value.
     */
    public ErrorVariant variant() {
        return variant;
    }

    /**
     * @return The field values in declaration order.
     */
    public List<Object> values() {
        return values;
    }

    /**
     * @param index A zero-based field position.
     * @return The value of the field.
     */
    public Object field(int index) {
        return values.get(index);
    }

    /**
     * @param name A field name.
     * @return The value of the field.
     * @throws IllegalArgumentException if the variant has no such field.
     */
    public Object field(String name) {
        if (variant.descriptor().fieldShape() instanceof FieldShape.Named named) {
            int index = named.names().indexOf(name);
            if (index >= 0) {
                return values.get(index);
            }
        }
        throw new IllegalArgumentException("Variant " + variant.identifier() + " has no field '" + name + "'.");
    }

    @Override
    public Severity kind() {
        return variant.descriptor().severity();
    }

    @Override
    public String numericCode() {
        return variant.descriptor().numericCode();
    }

    @Override
    public String code() {
        return variant.descriptor().code();
    }

    @Override
    public Span primarySpan() {
        if (variant.descriptor().spanRule() instanceof SpanRule.FromField spanField) {
            Object span = values.get(spanField.fieldIndex());
            if (span != null) {
                return (Span) span;
            }
        }
        return SimpleSpan.EMPTY;
    }

    @Override
    public String primaryMessage() {
        return render(variant.descriptor().message());
    }

    @Override
    public String primaryLabel() {
        return render(variant.descriptor().label());
    }

    private String render(CompiledTemplate template) {
        return TemplateRenderer.render(template, ref -> {
            if (ref instanceof CompiledTemplate.Positional positional) {
                return field(positional.index());
            }
            return field(((CompiledTemplate.Named) ref).name());
        });
    }

    /**
     * @return The message, as the display form of this value.
     */
    @Override
    public String toString() {
        return primaryMessage();
    }

    /**
     * @return The variant name and its fields in debug form, e.g. {@code FileNotFound { path: "fs.rs" }}.
     */
    public String toDebugString() {
        VariantDescriptor d = variant.descriptor();
        FieldShape shape = d.fieldShape();
        StringBuilder sb = new StringBuilder(d.identifier());
        if (shape instanceof FieldShape.Named named) {
            sb.append(" { ");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(named.names().get(i)).append(": ").append(TemplateRenderer.debug(values.get(i)));
            }
            sb.append(" }");
        } else if (shape instanceof FieldShape.Positional) {
            sb.append('(');
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(TemplateRenderer.debug(values.get(i)));
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
