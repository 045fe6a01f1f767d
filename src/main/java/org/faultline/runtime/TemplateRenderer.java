package org.faultline.runtime;

import org.faultline.compiler.api.CompiledTemplate;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Renders compiled templates against field values.
 * <p>
 * A bare placeholder renders the display form of a value; {@code :?} renders its debug form, in
 * which strings, paths and characters are quoted and escaped. A field holding another
 * {@link ErrorDiagnostic} displays as that diagnostic's message.
 */
public final class TemplateRenderer {

    private TemplateRenderer() {}

    /**
     * Renders a template.
     *
     * @param template The compiled template.
     * @param values Resolves a field reference to the field's value.
     * @return The rendered text.
     * @throws IllegalStateException if a placeholder carries an unsupported format spec.
     */
    public static String render(CompiledTemplate template, Function<CompiledTemplate.FieldRef, Object> values) {
        StringBuilder out = new StringBuilder();
        for (CompiledTemplate.Segment segment : template.segments()) {
            if (segment instanceof CompiledTemplate.Literal literal) {
                out.append(literal.text());
            } else if (segment instanceof CompiledTemplate.Placeholder placeholder) {
                FormatSpec spec = FormatSpec.parse(placeholder.formatSpec());
                if (spec == null) {
                    throw new IllegalStateException("Unsupported format spec '" + placeholder.formatSpec()
                            + "' in template \"" + template.source() + "\"");
                }
                out.append(format(values.apply(placeholder.field()), spec));
            }
        }
        return out.toString();
    }

    /**
     * Formats one value.
     * @param value The value, may be null.
     * @param spec The format spec.
     * @return The formatted text.
     */
    public static String format(Object value, FormatSpec spec) {
        String text;
        boolean numeric = value instanceof Number;
        if (spec.precision() >= 0 && isDecimal(value)) {
            text = String.format(Locale.ROOT, "%." + spec.precision() + "f", value);
        } else {
            text = spec.debug() ? debug(value) : display(value);
            if (spec.precision() >= 0 && !numeric && text.length() > spec.precision()) {
                text = text.substring(0, spec.precision());
            }
        }
        return spec.pad(text, numeric);
    }

    /**
     * @param value A field value.
     * @return The display form of the value.
     */
    public static String display(Object value) {
        if (value instanceof ErrorDiagnostic diagnostic) {
            return diagnostic.primaryMessage();
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(TemplateRenderer::display).orElse("");
        }
        return String.valueOf(value);
    }

    /**
     * @param value A field value.
     * @return The debug form of the value.
     */
    public static String debug(Object value) {
        if (value instanceof ErrorInstance instance) {
            return instance.toDebugString();
        }
        if (value instanceof CharSequence || value instanceof Path) {
            return quote(value.toString(), '"');
        }
        if (value instanceof Character c) {
            return quote(c.toString(), '\'');
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(v -> "Some(" + debug(v) + ")").orElse("None");
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder sb = new StringBuilder("[");
            for (Object element : collection) {
                if (sb.length() > 1) sb.append(", ");
                sb.append(debug(element));
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (sb.length() > 1) sb.append(", ");
                sb.append(debug(e.getKey())).append(": ").append(debug(e.getValue()));
            }
            return sb.append('}').toString();
        }
        return String.valueOf(value);
    }

    private static boolean isDecimal(Object value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }

    private static String quote(String text, char quote) {
        StringBuilder sb = new StringBuilder().append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }
}
