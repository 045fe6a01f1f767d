package org.faultline.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A materialized error type: its name, documentation and variants in declaration order.
 */
public final class ErrorTypeDefinition {

    private final String name;
    private final List<String> documentation;
    private final Map<String, ErrorVariant> variants;

    /**
     * @param name The type name.
     * @param documentation The variant listing, one line per entry.
     * @param variants The variants in declaration order; identifiers must be unique.
     * @throws IllegalArgumentException if two variants share an identifier.
     */
    public ErrorTypeDefinition(String name, List<String> documentation, List<ErrorVariant> variants) {
        this.name = name;
        this.documentation = List.copyOf(documentation);
        Map<String, ErrorVariant> byName = new LinkedHashMap<>();
        for (ErrorVariant v : variants) {
            if (byName.putIfAbsent(v.identifier(), v) != null) {
                throw new IllegalArgumentException("Duplicate variant " + v.identifier() + " in type " + name);
            }
        }
        this.variants = Collections.unmodifiableMap(byName);
    }

    /**
     * @return The type name.
     */
    public String name() {
        return name;
    }

    /**
     * @return The variant listing.
     */
    public List<String> documentation() {
        return documentation;
    }

    /**
     * @return All variants, in declaration order.
     */
    public List<ErrorVariant> variants() {
        return new ArrayList<>(variants.values());
    }

    /**
     * @param identifier A variant name.
     * @return The variant, if declared.
     */
    public Optional<ErrorVariant> variant(String identifier) {
        return Optional.ofNullable(variants.get(identifier));
    }

    /**
     * @param identifier A variant name.
     * @return The variant.
     * @throws IllegalArgumentException if the type declares no such variant.
     */
    public ErrorVariant require(String identifier) {
        return variant(identifier).orElseThrow(() ->
                new IllegalArgumentException("Type " + name + " declares no variant " + identifier));
    }
}
