package org.faultline.compiler.frontend.resolve;

import org.faultline.compiler.frontend.parser.ast.SpanField;
import org.faultline.compiler.frontend.template.TemplateSource;
import org.faultline.runtime.Severity;

/**
 * The attributes in effect at one node of the taxonomy after inheritance.
 * Instances are immutable; each node derives its own from its parent's.
 *
 * @param kind The nearest declared severity, or null if none was declared on the path.
 * @param number The number fragments of all nodes from the root down to this one, concatenated.
 * @param msg The nearest declared message template, or null.
 * @param ownMsg The message template declared on this node itself, or null.
 * @param label The nearest declared label template, or null.
 * @param spanField The span-carrying field of a leaf, or null.
 * @param depth 1 for the taxonomy root, 2 for top-level nodes, and so on.
 * @param nested Whether this node itself is marked nested.
 */
public record NodeConfig(
        Severity kind,
        String number,
        TemplateSource msg,
        TemplateSource ownMsg,
        TemplateSource label,
        SpanField spanField,
        int depth,
        boolean nested
) {
    /**
     * @return The configuration above the taxonomy root: nothing declared, depth 0.
     */
    public static NodeConfig initial() {
        return new NodeConfig(null, "", null, null, null, null, 0, false);
    }

    /**
     * @return The declared severity, or {@link Severity#ERROR} if none was declared on the path.
     */
    public Severity severityOrDefault() {
        return kind != null ? kind : Severity.ERROR;
    }

    /**
     * @return The display code at this node: severity marker and accumulated number.
     */
    public String code() {
        return severityOrDefault().shortMarker() + number;
    }
}
