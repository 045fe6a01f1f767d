package org.faultline.compiler.backend.validate.features;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.EmissionException;
import org.faultline.compiler.api.VariantDescriptor;
import org.faultline.compiler.backend.validate.IValidationRule;
import org.faultline.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports variants sharing a display code. A shared code is a warning unless the rule is
 * configured to reject it.
 */
public class DuplicateCodeRule implements IValidationRule {

    private static final Logger LOG = LoggerFactory.getLogger(DuplicateCodeRule.class);

    private final boolean reject;

    /**
     * @param reject Whether a shared code fails the compilation.
     */
    public DuplicateCodeRule(boolean reject) {
        this.reject = reject;
    }

    @Override
    public void check(List<VariantDescriptor> descriptors, DiagnosticsEngine diagnostics) throws EmissionException {
        Map<String, VariantDescriptor> seen = new HashMap<>();
        for (VariantDescriptor d : descriptors) {
            VariantDescriptor first = seen.putIfAbsent(d.code(), d);
            if (first == null) {
                continue;
            }
            String message = "Variants '" + first.identifier() + "' and '" + d.identifier()
                    + "' share the code " + d.code() + ".";
            if (reject) {
                throw new EmissionException(CompilerErrorCode.DUPLICATE_CODE, message, d.sourceInfo());
            }
            LOG.warn("{} ({})", message, d.sourceInfo());
            diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_CODE, message, d.sourceInfo());
        }
    }
}
