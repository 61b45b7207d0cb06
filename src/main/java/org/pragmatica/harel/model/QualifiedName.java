package org.pragmatica.harel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dotted sequence of state names, e.g. {@code Running.Heating.Boost}.
 */
public record QualifiedName(List<String> segments) {
    public QualifiedName {
        segments = List.copyOf(segments);
    }

    public static final QualifiedName ROOT = new QualifiedName(List.of());

    public static QualifiedName of(String... segments) {
        return new QualifiedName(Arrays.asList(segments));
    }

    /**
     * Split a dotted path. Empty segments are rejected.
     */
    public static QualifiedName parse(String path) {
        if (path.isEmpty()) {
            return ROOT;
        }
        var segments = path.split("\\.", -1);
        for (var segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in qualified name '" + path + "'");
            }
        }
        return new QualifiedName(Arrays.asList(segments));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public String last() {
        if (isRoot()) {
            throw new IllegalStateException("Root name has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    public QualifiedName child(String name) {
        var childSegments = new ArrayList<>(segments);
        childSegments.add(name);
        return new QualifiedName(childSegments);
    }

    public QualifiedName concat(QualifiedName relative) {
        var joined = new ArrayList<>(segments);
        joined.addAll(relative.segments);
        return new QualifiedName(joined);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
