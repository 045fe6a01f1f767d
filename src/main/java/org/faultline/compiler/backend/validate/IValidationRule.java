package org.faultline.compiler.backend.validate;

import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.VariantDescriptor;
import org.faultline.compiler.diagnostics.DiagnosticsEngine;

import java.util.List;

/**
 * A check applied to the complete list of emitted descriptors.
 */
public interface IValidationRule {

    /**
     * Checks the descriptors of one taxonomy.
     *
     * @param descriptors The descriptors, in declaration order.
     * @param diagnostics Receives warnings; errors are thrown instead.
     * @throws CompilationException if the rule rejects the taxonomy.
     */
    void check(List<VariantDescriptor> descriptors, DiagnosticsEngine diagnostics) throws CompilationException;
}
