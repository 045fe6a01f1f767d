package org.faultline.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SpanRule;
import org.faultline.compiler.api.TaxonomyArtifact;
import org.faultline.compiler.api.VariantDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a compiled taxonomy to disk for inspection: {@code descriptors.json} and {@code documentation.md}
 * in a directory named after the taxonomy.
 */
public final class ArtifactDump {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactDump.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private ArtifactDump() {}

    /**
     * Dumps an artifact.
     * @param directory The dump root.
     * @param artifact The compiled taxonomy.
     * @return The directory the files were written to.
     * @throws IOException if the files cannot be written.
     */
    public static Path dump(Path directory, TaxonomyArtifact artifact) throws IOException {
        Path root = directory.resolve(sanitize(artifact.name()));
        Files.createDirectories(root);
        Files.writeString(root.resolve("descriptors.json"), GSON.toJson(toJson(artifact)), StandardCharsets.UTF_8);
        Files.writeString(root.resolve("documentation.md"), artifact.documentationText() + "\n", StandardCharsets.UTF_8);
        LOG.debug("Dumped taxonomy {} to {}", artifact.name(), root);
        return root;
    }

    /**
     * @param artifact The compiled taxonomy.
     * @return The JSON form of the taxonomy and its descriptors.
     */
    public static JsonObject toJson(TaxonomyArtifact artifact) {
        JsonObject json = new JsonObject();
        json.addProperty("name", artifact.name());
        json.addProperty("visibility", artifact.visibility());
        json.addProperty("generics", artifact.generics());
        JsonArray variants = new JsonArray();
        for (VariantDescriptor d : artifact.descriptors()) {
            variants.add(toJson(d));
        }
        json.add("variants", variants);
        return json;
    }

    private static JsonObject toJson(VariantDescriptor d) {
        JsonObject json = new JsonObject();
        json.addProperty("identifier", d.identifier());
        json.addProperty("code", d.code());
        json.addProperty("severity", d.severity().name());
        json.addProperty("numericCode", d.numericCode());

        JsonObject shape = new JsonObject();
        if (d.fieldShape() instanceof FieldShape.Named named) {
            shape.addProperty("kind", "named");
            JsonArray names = new JsonArray();
            named.names().forEach(names::add);
            shape.add("names", names);
        } else if (d.fieldShape() instanceof FieldShape.Positional positional) {
            shape.addProperty("kind", "positional");
            shape.addProperty("count", positional.count());
        } else {
            shape.addProperty("kind", "unit");
        }
        json.add("fields", shape);

        JsonArray types = new JsonArray();
        d.fieldTypes().forEach(types::add);
        json.add("fieldTypes", types);

        json.addProperty("message", d.message().source());
        json.addProperty("label", d.label().source());
        if (d.spanRule() instanceof SpanRule.FromField span) {
            json.addProperty("spanField", span.fieldName());
        }
        json.addProperty("nested", d.nested());
        json.addProperty("source", String.valueOf(d.sourceInfo()));
        return json;
    }

    private static String sanitize(String s) {
        return s.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
