package org.faultline.compiler.backend.validate.features;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.EmissionException;
import org.faultline.compiler.api.VariantDescriptor;
import org.faultline.compiler.backend.validate.IValidationRule;
import org.faultline.compiler.diagnostics.DiagnosticsEngine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejects taxonomies that declare two variants with the same identifier.
 * The second declaration is reported.
 */
public class DuplicateIdentifierRule implements IValidationRule {

    @Override
    public void check(List<VariantDescriptor> descriptors, DiagnosticsEngine diagnostics) throws EmissionException {
        Map<String, VariantDescriptor> seen = new HashMap<>();
        for (VariantDescriptor d : descriptors) {
            VariantDescriptor first = seen.putIfAbsent(d.identifier(), d);
            if (first != null) {
                throw new EmissionException(CompilerErrorCode.DUPLICATE_IDENTIFIER,
                        "Variant '" + d.identifier() + "' is already declared at " + first.sourceInfo() + ".",
                        d.sourceInfo());
            }
        }
    }
}
