package org.faultline.compiler.backend.materialize;

import org.faultline.compiler.Compiler;
import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.TaxonomyArtifact;
import org.faultline.runtime.ErrorTypeDefinition;
import org.faultline.runtime.ErrorVariant;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the materialization seam and the in-memory materializer.
 */
@ExtendWith(MockitoExtension.class)
public class RuntimeVariantMaterializerTest {

    private static final String SOURCE = String.join("\n",
            "Fs {",
            "    #[diag(number = \"0\", msg = \"File {path:?} Not Found\")] FileNotFound { path: PathBuf },",
            "    #[diag(kind = \"Warn\", number = \"1\", msg = \"Slow disk.\")] Slow,",
            "}");

    @Mock
    private VariantMaterializer<String> materializer;

    /**
     * The compiler hands the compiled artifact to the materializer and returns its result.
     */
    @Test
    @Tag("unit")
    void compilerPassesArtifactToMaterializer() throws Exception {
        // Arrange
        when(materializer.materialize(any())).thenReturn("materialized");
        ArgumentCaptor<TaxonomyArtifact> captor = ArgumentCaptor.forClass(TaxonomyArtifact.class);

        // Act
        String result = new Compiler().compile(SOURCE, "fs.fl", materializer);

        // Assert
        assertThat(result).isEqualTo("materialized");
        verify(materializer).materialize(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo("Fs");
        assertThat(captor.getValue().descriptors()).hasSize(2);
    }

    /**
     * A failed compilation never reaches the materializer.
     */
    @Test
    @Tag("unit")
    void materializerIsNotCalledOnFailure() {
        assertThatThrownBy(() -> new Compiler().compile("Fs { NoMessage }", "fs.fl", materializer))
                .isInstanceOf(CompilationException.class);
        verifyNoInteractions(materializer);
    }

    /**
     * The runtime materializer produces one variant per descriptor, in declaration order.
     */
    @Test
    @Tag("unit")
    void materializesRuntimeType() throws Exception {
        ErrorTypeDefinition type = new Compiler().compile(SOURCE, "fs.fl", new RuntimeVariantMaterializer());

        assertThat(type.name()).isEqualTo("Fs");
        assertThat(type.variants()).extracting(ErrorVariant::identifier).containsExactly("FileNotFound", "Slow");
        assertThat(type.documentation()).first().isEqualTo("List of error variants:");
        assertThat(type.variant("Missing")).isEmpty();

        ErrorVariant fileNotFound = type.require("FileNotFound");
        assertThat(fileNotFound.code()).isEqualTo("E0");
        assertThat(fileNotFound.instantiate(Map.of("path", "fs.rs")).primaryMessage())
                .isEqualTo("File \"fs.rs\" Not Found");
    }
}
