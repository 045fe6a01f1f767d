package org.faultline.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the taxonomy compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given taxonomy source.
     *
     * @param source The taxonomy source text.
     * @param fileName A logical name for the source, used in error positions.
     * @return A {@link TaxonomyArtifact} with one descriptor per variant.
     * @throws CompilationException if the first error is found; no partial output is produced.
     */
    TaxonomyArtifact compile(String source, String fileName) throws CompilationException;

    /**
     * Compiles the taxonomy stored in a file.
     * @param path The path of the taxonomy file.
     * @return The compiled artifact.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default TaxonomyArtifact compile(Path path) throws CompilationException, IOException {
        return compile(Files.readString(path, StandardCharsets.UTF_8), path.toString().replace('\\', '/'));
    }
}
