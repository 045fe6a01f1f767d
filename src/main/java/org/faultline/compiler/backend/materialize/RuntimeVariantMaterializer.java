package org.faultline.compiler.backend.materialize;

import org.faultline.compiler.api.TaxonomyArtifact;
import org.faultline.runtime.ErrorTypeDefinition;
import org.faultline.runtime.ErrorVariant;

/**
 * Materializes a taxonomy as an in-memory {@link ErrorTypeDefinition} whose values render their
 * messages from the compiled templates.
 */
public class RuntimeVariantMaterializer implements VariantMaterializer<ErrorTypeDefinition> {

    @Override
    public ErrorTypeDefinition materialize(TaxonomyArtifact artifact) {
        return new ErrorTypeDefinition(artifact.name(), artifact.documentation(),
                artifact.descriptors().stream().map(ErrorVariant::new).toList());
    }
}
