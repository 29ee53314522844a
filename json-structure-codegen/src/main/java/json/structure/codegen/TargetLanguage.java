package json.structure.codegen;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// The languages classes can be generated in.
public enum TargetLanguage {
    TYPESCRIPT("typescript"),
    PYTHON("python"),
    JAVA("java"),
    CSHARP("csharp"),
    GO("go"),
    SWIFT("swift"),
    RUBY("ruby"),
    DART("dart"),
    KOTLIN("kotlin"),
    /// A draft-07 JSON Schema document rather than executable code.
    JSON_SCHEMA("json_schema");

    private final String id;

    TargetLanguage(String id) {
        this.id = id;
    }

    /// {@return the identifier used on the command line}
    public String id() {
        return id;
    }

    /// {@return a new emitter for this language}
    public ClassEmitter emitter() {
        return switch (this) {
            case TYPESCRIPT -> new TypeScriptEmitter();
            case PYTHON -> new PythonEmitter();
            case JAVA -> new JavaEmitter();
            case CSHARP -> new CSharpEmitter();
            case GO -> new GoEmitter();
            case SWIFT -> new SwiftEmitter();
            case RUBY -> new RubyEmitter();
            case DART -> new DartEmitter();
            case KOTLIN -> new KotlinEmitter();
            case JSON_SCHEMA -> new JsonSchemaEmitter();
        };
    }

    /// Looks up a language by its [#id()], ignoring case.
    /// @throws IllegalArgumentException if no language has this id
    public static TargetLanguage fromId(String id) {
        final var wanted = id.toLowerCase(Locale.ROOT);
        for (final var language : values()) {
            if (language.id.equals(wanted)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown target language '" + id + "', expected one of: "
                + Arrays.stream(values()).map(TargetLanguage::id).collect(Collectors.joining(", ")));
    }
}
