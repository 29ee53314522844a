package json.structure.schema;

import java.util.Objects;

/// One field of an inferred class.
///
/// @param sourceKey the key as it appears in the sample
/// @param generatedName the sanitised camelCase identifier
/// @param shape the inferred type
/// @param nullable `true` when the sample value was `null`
public record FieldDescriptor(String sourceKey, String generatedName, Shape shape, boolean nullable) {

    public FieldDescriptor {
        Objects.requireNonNull(sourceKey, "sourceKey must not be null");
        Objects.requireNonNull(generatedName, "generatedName must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
    }
}
