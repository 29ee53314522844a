package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.SchemaInference;
import json.structure.tree.Json;
import json.structure.tree.JsonParseException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Generates classes from a JSON sample: parse, infer, then emit.
///
/// ```java
/// final var source = JsonStructureGenerator.generate(
///     "{\"id\": 1, \"tags\": [\"a\"]}", "Item", TargetLanguage.KOTLIN);
/// // data class Item(
/// //     val id: Long,
/// //     val tags: List<String>
/// // )
/// ```
///
/// Callers that want several languages from one sample should use
/// [#generateAll(String, String, Collection)], which infers once.
public final class JsonStructureGenerator {

    private static final Logger LOG = Logger.getLogger(JsonStructureGenerator.class.getName());

    private JsonStructureGenerator() {
    }

    /// Generates source for one language.
    /// @throws JsonParseException if `sampleText` is not valid JSON
    public static String generate(String sampleText, String rootClassName, TargetLanguage language) {
        Objects.requireNonNull(language, "language must not be null");
        return emit(infer(sampleText, rootClassName), language);
    }

    /// Generates source for several languages from one inference, in the
    /// order the languages are given.
    /// @throws JsonParseException if `sampleText` is not valid JSON
    public static Map<TargetLanguage, String> generateAll(String sampleText, String rootClassName,
                                                          Collection<TargetLanguage> languages) {
        Objects.requireNonNull(languages, "languages must not be null");
        final var schema = infer(sampleText, rootClassName);
        final var out = new LinkedHashMap<TargetLanguage, String>();
        for (final var language : languages) {
            out.put(language, emit(schema, language));
        }
        return out;
    }

    /// Parses the sample and infers its class tree.
    /// @throws JsonParseException if `sampleText` is not valid JSON
    public static ClassSchema infer(String sampleText, String rootClassName) {
        Objects.requireNonNull(sampleText, "sampleText must not be null");
        Objects.requireNonNull(rootClassName, "rootClassName must not be null");
        return SchemaInference.infer(Json.parse(sampleText), rootClassName);
    }

    /// Renders an already inferred class tree.
    public static String emit(ClassSchema schema, TargetLanguage language) {
        LOG.fine(() -> "Emitting " + schema.name() + " as " + language.id());
        return language.emitter().emit(schema);
    }
}
