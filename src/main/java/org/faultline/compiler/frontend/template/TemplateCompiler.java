package org.faultline.compiler.frontend.template;

import org.faultline.compiler.api.CompiledTemplate;
import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.TemplateException;
import org.faultline.runtime.FormatSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles message and label templates against the field shape of a variant.
 * <p>
 * Placeholders are written <code>{ref}</code> or <code>{ref:spec}</code>, where <code>ref</code> is a
 * field position, a field name or empty (the next implicit position). <code>{{</code> and
 * <code>}}</code> stand for literal braces. Every reference is checked against the field shape; the first violation
 * fails the template.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class TemplateCompiler {

    /**
     * Compiles a template.
     *
     * @param template The template text and position.
     * @param shape The field shape of the variant the template belongs to.
     * @return The compiled template.
     * @throws TemplateException if a placeholder is malformed or does not fit the shape.
     */
    public CompiledTemplate compile(TemplateSource template, FieldShape shape) throws TemplateException {
        String text = template.text();
        List<CompiledTemplate.Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int implicitIndex = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = text.indexOf('}', i + 1);
                int nextOpen = text.indexOf('{', i + 1);
                if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                    throw error(template, CompilerErrorCode.UNBALANCED_BRACES,
                            "Unterminated placeholder at position " + i + " in template \"" + text + "\".");
                }
                Matcher m = PatternHolder.PLACEHOLDER.matcher(text.substring(i + 1, close));
                if (!m.matches()) {
                    throw error(template, CompilerErrorCode.MALFORMED_PLACEHOLDER,
                            "Malformed placeholder '" + text.substring(i, close + 1) + "' in template \"" + text + "\".");
                }
                CompiledTemplate.FieldRef ref;
                if (m.group("index") != null) {
                    ref = positional(template, shape, parseIndex(template, m.group("index")));
                } else if (m.group("name") != null) {
                    ref = named(template, shape, m.group("name"));
                } else {
                    ref = positional(template, shape, implicitIndex++);
                }
                if (literal.length() > 0) {
                    segments.add(new CompiledTemplate.Literal(literal.toString()));
                    literal.setLength(0);
                }
                String spec = m.group("spec") != null ? m.group("spec") : "";
                if (FormatSpec.parse(spec) == null) {
                    throw error(template, CompilerErrorCode.MALFORMED_PLACEHOLDER,
                            "Unsupported format spec '" + spec + "' in template \"" + text + "\".");
                }
                segments.add(new CompiledTemplate.Placeholder(ref, spec));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw error(template, CompilerErrorCode.UNBALANCED_BRACES,
                        "Unmatched '}' at position " + i + " in template \"" + text + "\". Write '}}' for a literal brace.");
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(new CompiledTemplate.Literal(literal.toString()));
        }
        return new CompiledTemplate(text, segments, template.sourceInfo());
    }

    private CompiledTemplate.FieldRef positional(TemplateSource template, FieldShape shape, int index) throws TemplateException {
        if (shape instanceof FieldShape.Positional positional) {
            if (index >= positional.count()) {
                throw error(template, CompilerErrorCode.PLACEHOLDER_INDEX_OUT_OF_RANGE,
                        "Placeholder {" + index + "} is out of range: the variant has " + positional.count() + " field(s).");
            }
            return new CompiledTemplate.Positional(index);
        } else if (shape instanceof FieldShape.Named) {
            throw error(template, CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH,
                    "Positional placeholder {" + index + "} used in a variant with named fields.");
        } else {
            throw error(template, CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH,
                    "Placeholder {" + index + "} used in a variant without fields.");
        }
    }

    private CompiledTemplate.FieldRef named(TemplateSource template, FieldShape shape, String name) throws TemplateException {
        if (shape instanceof FieldShape.Named named) {
            if (!named.names().contains(name)) {
                throw error(template, CompilerErrorCode.UNKNOWN_PLACEHOLDER_FIELD,
                        "Placeholder {" + name + "} does not name a field. Declared fields: " + named.names() + ".");
            }
            return new CompiledTemplate.Named(name);
        } else if (shape instanceof FieldShape.Positional) {
            throw error(template, CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH,
                    "Named placeholder {" + name + "} used in a variant with positional fields.");
        } else {
            throw error(template, CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH,
                    "Placeholder {" + name + "} used in a variant without fields.");
        }
    }

    private int parseIndex(TemplateSource template, String digits) throws TemplateException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error(template, CompilerErrorCode.MALFORMED_PLACEHOLDER, "Invalid placeholder index: " + digits);
        }
    }

    private static TemplateException error(TemplateSource template, CompilerErrorCode code, String message) {
        return new TemplateException(code, message, template.sourceInfo());
    }

    /**
     * Holds the placeholder body pattern. Initialized once, on first use, and immutable afterwards.
     */
    private static final class PatternHolder {
        static final Pattern PLACEHOLDER =
                Pattern.compile("(?:(?<index>[0-9]+)|(?<name>[A-Za-z_][A-Za-z0-9_]*))?(?::(?<spec>[^{}]*))?");
    }
}
