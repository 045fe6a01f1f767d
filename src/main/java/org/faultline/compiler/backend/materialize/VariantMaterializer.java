package org.faultline.compiler.backend.materialize;

import org.faultline.compiler.api.TaxonomyArtifact;

/**
 * Turns a compiled taxonomy into a concrete error type of some target representation.
 *
 * @param <T> The type produced.
 */
@FunctionalInterface
public interface VariantMaterializer<T> {

    /**
     * @param artifact The compiled taxonomy.
     * @return The materialized type.
     */
    T materialize(TaxonomyArtifact artifact);
}
