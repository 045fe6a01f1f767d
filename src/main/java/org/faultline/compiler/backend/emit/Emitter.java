package org.faultline.compiler.backend.emit;

import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.CompiledTemplate;
import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.EmissionException;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SpanRule;
import org.faultline.compiler.api.TaxonomyArtifact;
import org.faultline.compiler.api.VariantDescriptor;
import org.faultline.compiler.frontend.parser.ast.LeafNode;
import org.faultline.compiler.frontend.parser.ast.TaxonomyNode;
import org.faultline.compiler.frontend.resolve.AttributeResolver;
import org.faultline.compiler.frontend.resolve.NodeConfig;
import org.faultline.compiler.frontend.resolve.ResolvedNode;
import org.faultline.compiler.frontend.template.TemplateCompiler;
import org.faultline.compiler.frontend.template.TemplateSource;
import org.faultline.runtime.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Emitter is the final stage of the compiler. It walks the resolved taxonomy and produces the
 * {@link TaxonomyArtifact}: one {@link VariantDescriptor} per leaf and the documentation listing,
 * both in declaration order.
 */
public class Emitter {

    private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);

    /** The first line of every documentation listing. */
    public static final String DOCUMENTATION_HEADER = "List of error variants:";

    private final TemplateCompiler templateCompiler;

    /**
     * Creates an emitter with its own template compiler.
     */
    public Emitter() {
        this(new TemplateCompiler());
    }

    /**
     * @param templateCompiler The compiler used for message and label templates.
     */
    public Emitter(TemplateCompiler templateCompiler) {
        this.templateCompiler = templateCompiler;
    }

    /**
     * Emits the artifact of a parsed taxonomy.
     *
     * @param taxonomy The parsed taxonomy.
     * @return The compiled artifact.
     * @throws CompilationException the first attribute, template or emission error in declaration order.
     */
    public TaxonomyArtifact emit(TaxonomyNode taxonomy) throws CompilationException {
        AttributeResolver resolver = new AttributeResolver(taxonomy);
        List<VariantDescriptor> descriptors = new ArrayList<>();
        List<String> documentation = new ArrayList<>();
        documentation.add(DOCUMENTATION_HEADER);

        resolver.forEach(node -> {
            documentation.add(documentationLine(node));
            if (node.node() instanceof LeafNode leaf) {
                descriptors.add(describe(node.config(), leaf));
            }
        });

        LOG.debug("Emitted {} variant descriptors for {}", descriptors.size(), taxonomy.name().text());
        return new TaxonomyArtifact(taxonomy.name().text(), taxonomy.visibility(), taxonomy.generics(),
                taxonomy.hostAttributes(), descriptors, documentation);
    }

    /**
     * Builds the descriptor of one leaf.
     *
     * @param config The resolved configuration of the leaf.
     * @param leaf The leaf.
     * @return The descriptor.
     * @throws CompilationException if the leaf has no message or a template does not fit its fields.
     */
    VariantDescriptor describe(NodeConfig config, LeafNode leaf) throws CompilationException {
        FieldShape shape = leaf.shape();
        if (config.nested() && shape.fieldCount() != 1) {
            throw new EmissionException(CompilerErrorCode.NESTED_VARIANT_FIELD_COUNT,
                    "Nested variant '" + leaf.name() + "' must have exactly one field, but has " + shape.fieldCount() + ".",
                    leaf.sourceInfo());
        }

        TemplateSource msgSource = config.msg();
        if (msgSource == null) {
            throw new EmissionException(CompilerErrorCode.MISSING_MESSAGE,
                    "Missing message for variant '" + leaf.name() + "'. Consider using `#[diag(msg = \"...\")]`.",
                    leaf.sourceInfo());
        }
        CompiledTemplate message = templateCompiler.compile(msgSource, shape);
        CompiledTemplate label = config.label() != null
                ? templateCompiler.compile(config.label(), shape)
                : message;

        SpanRule spanRule = leaf.spanField() != null
                ? new SpanRule.FromField(leaf.spanField().name(), leaf.spanField().index())
                : SpanRule.Default.INSTANCE;

        Severity severity = config.severityOrDefault();
        return new VariantDescriptor(leaf.name(), shape, leaf.fieldTypes(), severity, config.number(),
                severity.shortMarker() + config.number(), message, label, spanRule, config.nested(),
                leaf.hostAttributes(), leaf.sourceInfo());
    }

    /**
     * One line of the listing: {@code - `CODE`(**Ident**): msg} for variants,
     * {@code - `CODE`: msg} for groups. Two spaces of indentation per level below the top.
     */
    private static String documentationLine(ResolvedNode node) {
        NodeConfig config = node.config();
        String indent = "  ".repeat(Math.max(0, config.depth() - 2));
        String code = config.code();
        if (node.node() instanceof LeafNode leaf) {
            TemplateSource msg = config.msg();
            return msg != null
                    ? indent + "- `" + code + "`(**" + leaf.name() + "**): " + msg.text()
                    : indent + "- `" + code + "`(**" + leaf.name() + "**)";
        }
        TemplateSource own = config.ownMsg();
        return own != null
                ? indent + "- `" + code + "`: " + own.text()
                : indent + "- `" + code + "`";
    }
}
