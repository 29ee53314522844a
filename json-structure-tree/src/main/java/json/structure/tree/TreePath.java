package json.structure.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// An address of a node inside a [JsonValue] tree.
///
/// A path is an ordered sequence of segments, each either an object member
/// name ([Key]) or an array position ([Index]). The empty path denotes the
/// root. Paths are plain immutable values: because edits never mutate a
/// tree, a path taken before an edit still describes the same location in
/// the old root.
///
/// ```java
/// TreePath p = TreePath.of("orders", 0, "total");
/// p.parent();   // /orders/0
/// p.last();     // Key[name=total]
/// ```
public final class TreePath {

    /// One step of a path.
    public sealed interface Segment permits Key, Index {}

    /// Selects an object member by name.
    /// @param name the member name
    public record Key(String name) implements Segment {
        public Key {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /// Selects an array element by zero-based position.
    /// @param index the position; negative positions never resolve
    public record Index(int index) implements Segment {
        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }

    private static final TreePath ROOT = new TreePath(List.of());

    private final List<Segment> segments;

    private TreePath(List<Segment> segments) {
        this.segments = segments;
    }

    /// {@return the empty path addressing the root}
    public static TreePath root() {
        return ROOT;
    }

    /// {@return a path built from `String` (member name) and `Integer` (index) segments}
    /// @throws IllegalArgumentException if a segment is neither
    public static TreePath of(Object... segments) {
        final var list = new ArrayList<Segment>(segments.length);
        for (final Object s : segments) {
            if (s instanceof String name) {
                list.add(new Key(name));
            } else if (s instanceof Integer index) {
                list.add(new Index(index));
            } else if (s instanceof Segment segment) {
                list.add(segment);
            } else {
                throw new IllegalArgumentException("Path segment must be a String or Integer, got: "
                        + (s == null ? "null" : s.getClass().getSimpleName()));
            }
        }
        return new TreePath(List.copyOf(list));
    }

    /// {@return a path from the given segments}
    public static TreePath of(List<? extends Segment> segments) {
        return new TreePath(List.copyOf(segments));
    }

    /// {@return the segments of this path, root first}
    public List<Segment> segments() {
        return segments;
    }

    /// {@return the number of segments}
    public int size() {
        return segments.size();
    }

    /// {@return `true` if this is the empty path}
    public boolean isRoot() {
        return segments.isEmpty();
    }

    /// {@return the path to the parent node; the root's parent is the root}
    public TreePath parent() {
        return isRoot() ? this : new TreePath(segments.subList(0, segments.size() - 1));
    }

    /// {@return the final segment}
    /// @throws IllegalStateException on the root path
    public Segment last() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    /// {@return this path extended by a member name}
    public TreePath child(String name) {
        return append(new Key(name));
    }

    /// {@return this path extended by an array index}
    public TreePath child(int index) {
        return append(new Index(index));
    }

    private TreePath append(Segment segment) {
        final var list = new ArrayList<>(segments);
        list.add(segment);
        return new TreePath(List.copyOf(list));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TreePath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /// {@return a JSON-Pointer-like rendering such as `/orders/0/total`; the root is `/`}
    @Override
    public String toString() {
        if (isRoot()) {
            return "/";
        }
        final var sb = new StringBuilder();
        for (final Segment s : segments) {
            sb.append('/').append(s.toString().replace("~", "~0").replace("/", "~1"));
        }
        return sb.toString();
    }
}
