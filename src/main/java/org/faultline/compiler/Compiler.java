package org.faultline.compiler;

import com.typesafe.config.Config;
import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.ICompiler;
import org.faultline.compiler.api.TaxonomyArtifact;
import org.faultline.compiler.backend.emit.Emitter;
import org.faultline.compiler.backend.materialize.VariantMaterializer;
import org.faultline.compiler.backend.validate.IValidationRule;
import org.faultline.compiler.backend.validate.ValidationRegistry;
import org.faultline.compiler.diagnostics.DiagnosticsEngine;
import org.faultline.compiler.frontend.lexer.Lexer;
import org.faultline.compiler.frontend.lexer.Token;
import org.faultline.compiler.frontend.parser.Parser;
import org.faultline.compiler.frontend.parser.ast.TaxonomyNode;
import org.faultline.compiler.util.ArtifactDump;
import org.faultline.config.ConfigLoader;
import org.faultline.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from taxonomy source
 * to a {@link TaxonomyArtifact}. It is not thread-safe; use one instance per thread.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final CompilerOptions options;
    private final ValidationRegistry validation;

    /**
     * Creates a compiler with the options of the application configuration,
     * as loaded by {@link ConfigLoader#load()}.
     */
    public Compiler() {
        this(CompilerOptions.fromConfig(ConfigLoader.load()));
    }

    /**
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
        this.validation = ValidationRegistry.initializeWithDefaults(options);
    }

    /**
     * Creates a compiler from a loaded configuration and applies its {@code logging} block.
     *
     * @param config The application configuration.
     * @return A compiler using the {@code faultline.compiler} options of {@code config}.
     */
    public static Compiler fromConfig(Config config) {
        LoggingConfigurator.configure(config);
        return new Compiler(CompilerOptions.fromConfig(config));
    }

    /**
     * {@inheritDoc}
     * <p>
     * Diagnostics of earlier compilations are discarded. A failure is recorded in
     * {@link #getDiagnostics()} before it is thrown.
     */
    @Override
    public TaxonomyArtifact compile(String source, String fileName) throws CompilationException {
        diagnostics.clear();
        String logicalName = fileName != null ? fileName : options.defaultFileName();
        try {
            // Phase 1: Lexical analysis
            List<Token> tokens = new Lexer(source, logicalName).scanTokens();

            // Phase 2: Parsing
            TaxonomyNode taxonomy = new Parser(tokens).parse();

            // Phase 3: Attribute resolution, template compilation and emission
            TaxonomyArtifact artifact = new Emitter().emit(taxonomy);

            // Phase 4: Validation
            for (IValidationRule rule : validation.rules()) {
                rule.check(artifact.descriptors(), diagnostics);
            }

            LOG.debug("Compiled taxonomy {} from {}: {} variants, {} warnings", artifact.name(), logicalName,
                    artifact.descriptors().size(), diagnostics.getWarnings().size());

            if (options.dumpEnabled()) {
                dump(artifact);
            }
            return artifact;
        } catch (CompilationException e) {
            diagnostics.reportError(e);
            throw e;
        }
    }

    /**
     * Compiles a taxonomy and hands the result to a materializer.
     *
     * @param source The taxonomy source text.
     * @param fileName A logical name for the source.
     * @param materializer Produces the target representation.
     * @param <T> The type produced by the materializer.
     * @return The materialized type.
     * @throws CompilationException if compilation fails; the materializer is not called then.
     */
    public <T> T compile(String source, String fileName, VariantMaterializer<T> materializer) throws CompilationException {
        return materializer.materialize(compile(source, fileName));
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions getOptions() {
        return options;
    }

    private void dump(TaxonomyArtifact artifact) {
        try {
            ArtifactDump.dump(Path.of(options.dumpDirectory()), artifact);
        } catch (IOException e) {
            LOG.warn("Failed to dump taxonomy {} to {}", artifact.name(), options.dumpDirectory(), e);
        }
    }
}
