package org.faultline.compiler.frontend.template;

import org.faultline.compiler.api.CompiledTemplate;
import org.faultline.compiler.api.CompiledTemplate.Literal;
import org.faultline.compiler.api.CompiledTemplate.Named;
import org.faultline.compiler.api.CompiledTemplate.Placeholder;
import org.faultline.compiler.api.CompiledTemplate.Positional;
import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SourceInfo;
import org.faultline.compiler.api.TemplateException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link TemplateCompiler}.
 */
public class TemplateCompilerTest {

    private static final SourceInfo WHERE = new SourceInfo("test.fl", 3, 12, 40, 60);
    private static final FieldShape PATH = new FieldShape.Named(List.of("path"));
    private static final FieldShape TWO = new FieldShape.Positional(2);

    private final TemplateCompiler compiler = new TemplateCompiler();

    private CompiledTemplate compile(String text, FieldShape shape) throws TemplateException {
        return compiler.compile(new TemplateSource(text, WHERE), shape);
    }

    private CompilerErrorCode failure(String text, FieldShape shape) {
        try {
            compile(text, shape);
        } catch (TemplateException e) {
            assertThat(e.getSourceInfo()).isEqualTo(WHERE);
            return e.getErrorCode();
        }
        throw new AssertionError("Template compiled: " + text);
    }

    /**
     * Named placeholders with a format spec split the template into literal and placeholder segments.
     */
    @Test
    @Tag("unit")
    void compilesNamedPlaceholder() throws Exception {
        CompiledTemplate template = compile("File {path:?} not found.", PATH);

        assertThat(template.segments()).containsExactly(
                new Literal("File "),
                new Placeholder(new Named("path"), "?"),
                new Literal(" not found."));
        assertThat(template.source()).isEqualTo("File {path:?} not found.");
        assertThat(template.sourceInfo()).isEqualTo(WHERE);
    }

    /**
     * Explicit and implicit positional references resolve to field indexes.
     */
    @Test
    @Tag("unit")
    void compilesPositionalPlaceholders() throws Exception {
        assertThat(compile("{0} and {1}", TWO).referencedFields())
                .containsExactly(new Positional(0), new Positional(1));
        assertThat(compile("{} then {}", TWO).referencedFields())
                .containsExactly(new Positional(0), new Positional(1));
        assertThat(compile("{1}{1}", TWO).segments()).hasSize(2);
    }

    /**
     * Doubled braces are literal and never open a placeholder.
     */
    @Test
    @Tag("unit")
    void doubledBracesAreLiteral() throws Exception {
        CompiledTemplate template = compile("{{0}} not found.", FieldShape.Unit.INSTANCE);

        assertThat(template.segments()).containsExactly(new Literal("{0} not found."));
        assertThat(template.referencedFields()).isEmpty();
    }

    /**
     * Scanning resumes after an escaped brace, so a placeholder right behind it is still found.
     */
    @Test
    @Tag("unit")
    void findsPlaceholderAfterEscapedBrace() throws Exception {
        CompiledTemplate template = compile("{{{path}}}", PATH);

        assertThat(template.segments()).containsExactly(
                new Literal("{"), new Placeholder(new Named("path"), ""), new Literal("}"));
    }

    /**
     * Positional references must stay below the field count.
     */
    @Test
    @Tag("unit")
    void rejectsIndexOutOfRange() {
        assertThat(failure("{2}", TWO)).isEqualTo(CompilerErrorCode.PLACEHOLDER_INDEX_OUT_OF_RANGE);
        assertThat(failure("{} {} {}", TWO)).isEqualTo(CompilerErrorCode.PLACEHOLDER_INDEX_OUT_OF_RANGE);
    }

    /**
     * References must fit the field shape of the variant.
     */
    @Test
    @Tag("unit")
    void rejectsReferencesThatDoNotFitTheShape() {
        assertThat(failure("{path}", TWO)).isEqualTo(CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH);
        assertThat(failure("{0}", PATH)).isEqualTo(CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH);
        assertThat(failure("{0}", FieldShape.Unit.INSTANCE)).isEqualTo(CompilerErrorCode.PLACEHOLDER_SHAPE_MISMATCH);
        assertThat(failure("{file}", PATH)).isEqualTo(CompilerErrorCode.UNKNOWN_PLACEHOLDER_FIELD);
    }

    /**
     * Unbalanced braces and malformed placeholder bodies are rejected.
     */
    @Test
    @Tag("unit")
    void rejectsMalformedTemplates() {
        assertThat(failure("oops {", PATH)).isEqualTo(CompilerErrorCode.UNBALANCED_BRACES);
        assertThat(failure("oops }", PATH)).isEqualTo(CompilerErrorCode.UNBALANCED_BRACES);
        assertThat(failure("{pa{th}", PATH)).isEqualTo(CompilerErrorCode.UNBALANCED_BRACES);
        assertThat(failure("{pa th}", PATH)).isEqualTo(CompilerErrorCode.MALFORMED_PLACEHOLDER);
        assertThat(failure("{path:%}", PATH)).isEqualTo(CompilerErrorCode.MALFORMED_PLACEHOLDER);
    }

    /**
     * The compiler is stateless and can be shared by threads.
     */
    @Test
    @Tag("unit")
    void compilesConcurrently() {
        List<Integer> sizes = IntStream.range(0, 200).parallel()
                .mapToObj(i -> {
                    try {
                        return compile("{path:>" + (i % 10) + "} #" + i, PATH).segments().size();
                    } catch (TemplateException e) {
                        throw new IllegalStateException(e);
                    }
                })
                .toList();

        assertThat(sizes).hasSize(200).containsOnly(2);
    }
}
