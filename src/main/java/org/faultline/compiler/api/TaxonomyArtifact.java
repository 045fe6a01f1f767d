package org.faultline.compiler.api;

import java.util.List;
import java.util.Optional;

/**
 * Represents the complete output of compiling one taxonomy.
 * This is an immutable data carrier; descriptors and documentation keep declaration order.
 *
 * @param name The taxonomy (type) name.
 * @param visibility The visibility keyword written before the name, or an empty string.
 * @param generics The generic parameter list as written, or an empty string.
 * @param hostAttributes Attributes on the taxonomy not addressed to the compiler.
 * @param descriptors One descriptor per variant, in declaration order.
 * @param documentation The variant listing, one line per group or variant, header first.
 */
public record TaxonomyArtifact(
        String name,
        String visibility,
        String generics,
        List<String> hostAttributes,
        List<VariantDescriptor> descriptors,
        List<String> documentation
) {
    public TaxonomyArtifact {
        hostAttributes = List.copyOf(hostAttributes);
        descriptors = List.copyOf(descriptors);
        documentation = List.copyOf(documentation);
    }

    /**
     * Looks up a descriptor by variant identifier.
     * @param identifier The variant name.
     * @return The descriptor, if the taxonomy declares such a variant.
     */
    public Optional<VariantDescriptor> descriptor(String identifier) {
        return descriptors.stream().filter(d -> d.identifier().equals(identifier)).findFirst();
    }

    /**
     * @return The documentation listing joined with newlines.
     */
    public String documentationText() {
        return String.join("\n", documentation);
    }
}
