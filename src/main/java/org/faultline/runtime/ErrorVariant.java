package org.faultline.runtime;

import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SpanRule;
import org.faultline.compiler.api.VariantDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One variant of a materialized error type. Creates {@link ErrorInstance}s from field values.
 */
public final class ErrorVariant {

    private final VariantDescriptor descriptor;

    /**
     * @param descriptor The compiled description of the variant.
     */
    public ErrorVariant(VariantDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * @return The compiled description of the variant.
     */
    public VariantDescriptor descriptor() {
        return descriptor;
    }

    /**
     * @return The variant name.
     */
    public String identifier() {
        return descriptor.identifier();
    }

    /**
     * @return The display code of the variant.
     */
    public String code() {
        return descriptor.code();
    }

    /**
     * Creates a value of this variant from field values in declaration order.
     * Works for every field shape; a unit variant takes no values.
     *
     * @param values The field values.
     * @return The new instance.
     * @throws IllegalArgumentException if the number of values does not match the fields,
     *         or the span field does not hold a {@link Span}.
     */
    public ErrorInstance instantiate(Object... values) {
        int expected = descriptor.fieldShape().fieldCount();
        if (values.length != expected) {
            throw new IllegalArgumentException("Variant " + identifier() + " expects " + expected
                    + " field value(s), but got " + values.length + ".");
        }
        return create(Arrays.asList(values));
    }

    /**
     * Creates a value of a variant with named fields.
     *
     * @param values The field values by name; every declared field must be present and no other.
     * @return The new instance.
     * @throws IllegalArgumentException if the variant has no named fields or the names do not match.
     */
    public ErrorInstance instantiate(Map<String, ?> values) {
        if (!(descriptor.fieldShape() instanceof FieldShape.Named named)) {
            throw new IllegalArgumentException("Variant " + identifier() + " has no named fields.");
        }
        Set<String> unknown = new HashSet<>(values.keySet());
        named.names().forEach(unknown::remove);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Variant " + identifier() + " has no field(s) " + unknown + ".");
        }
        List<Object> ordered = new ArrayList<>();
        for (String name : named.names()) {
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("Variant " + identifier() + " is missing field '" + name + "'.");
            }
            ordered.add(values.get(name));
        }
        return create(ordered);
    }

    private ErrorInstance create(List<Object> values) {
        if (descriptor.spanRule() instanceof SpanRule.FromField spanField) {
            Object span = values.get(spanField.fieldIndex());
            if (span != null && !(span instanceof Span)) {
                throw new IllegalArgumentException("Field '" + spanField.fieldName() + "' of variant " + identifier()
                        + " carries the span and must hold a Span, but holds " + span.getClass().getName() + ".");
            }
        }
        return new ErrorInstance(this, values);
    }

    @Override
    public String toString() {
        return identifier() + "[" + code() + "]";
    }
}
