package org.faultline.compiler.backend.validate;

import org.faultline.compiler.CompilerOptions;
import org.faultline.compiler.backend.validate.features.DuplicateCodeRule;
import org.faultline.compiler.backend.validate.features.DuplicateIdentifierRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for validation rules applied in order.
 */
public final class ValidationRegistry {

    private final List<IValidationRule> rules = new ArrayList<>();

    /**
     * Registers a new validation rule.
     * @param rule The rule to register.
     */
    public void register(IValidationRule rule) { rules.add(rule); }

    /**
     * @return The list of registered validation rules.
     */
    public List<IValidationRule> rules() { return rules; }

    /**
     * Initializes a new registry with the default rules.
     * @param options The compiler options the rules are configured from.
     * @return A new registry with default rules.
     */
    public static ValidationRegistry initializeWithDefaults(CompilerOptions options) {
        ValidationRegistry reg = new ValidationRegistry();
        reg.register(new DuplicateIdentifierRule());
        reg.register(new DuplicateCodeRule(options.rejectDuplicateCodes()));
        return reg;
    }
}
