package com.ffibind.generator.model.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Hierarchical name of a native or surface entity.
 *
 * A one-segment path is a built-in name that belongs to no package
 * (e.g. {@code i32}). For longer paths the first segment is the package name,
 * the last segment is the entity's own name and the segments in between are
 * module or namespace names.
 *
 * Ordering is lexicographic over segments and has nothing to do with the
 * identifier order of database collections.
 */
@EqualsAndHashCode
public final class ItemPath implements Comparable<ItemPath> {

    public static final String SEPARATOR = "::";

    /**
     * Prefix used when a path is rendered from inside its own package.
     */
    public static final String PACKAGE_ROOT_KEYWORD = "crate";

    private final List<String> segments;

    private ItemPath(List<String> segments) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("ItemPath can't be empty");
        }
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("ItemPath segment can't be empty: " + segments);
            }
        }
        this.segments = List.copyOf(segments);
    }

    public static ItemPath of(String... segments) {
        return new ItemPath(Arrays.asList(segments));
    }

    public static ItemPath fromSegments(@NonNull List<String> segments) {
        return new ItemPath(segments);
    }

    /**
     * Parses {@code a::b::c}.
     */
    public static ItemPath parse(@NonNull String text) {
        return new ItemPath(Arrays.asList(text.split(SEPARATOR, -1)));
    }

    public List<String> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    /**
     * Package owning this path, or empty for a built-in one-segment name.
     */
    public Optional<String> packageName() {
        return segments.size() > 1 ? Optional.of(segments.get(0)) : Optional.empty();
    }

    public String firstSegment() {
        return segments.get(0);
    }

    public String lastSegment() {
        return segments.get(segments.size() - 1);
    }

    public Optional<ItemPath> parent() {
        if (segments.size() == 1) {
            return Optional.empty();
        }
        return Optional.of(new ItemPath(segments.subList(0, segments.size() - 1)));
    }

    public ItemPath join(@NonNull String segment) {
        List<String> joined = new ArrayList<>(segments);
        joined.add(segment);
        return new ItemPath(joined);
    }

    public ItemPath withLastSegment(@NonNull String segment) {
        List<String> replaced = new ArrayList<>(segments);
        replaced.set(replaced.size() - 1, segment);
        return new ItemPath(replaced);
    }

    /**
     * Returns true if {@code other} is nested anywhere inside this path.
     */
    public boolean isAncestorOf(@NonNull ItemPath other) {
        return other.segments.size() > segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    /**
     * Returns true if {@code other} is nested exactly one level inside this path.
     */
    public boolean isDirectParentOf(@NonNull ItemPath other) {
        return other.segments.size() == segments.size() + 1 && isAncestorOf(other);
    }

    public boolean isChildOf(@NonNull ItemPath parent) {
        return parent.isDirectParentOf(this);
    }

    /**
     * Formats the path for use inside {@code currentPackage}.
     * Pass {@code null} when the text is used outside of any package.
     */
    public String render(String currentPackage) {
        if (segments.size() == 1) {
            return segments.get(0);
        }
        if (currentPackage != null && currentPackage.equals(segments.get(0))) {
            return PACKAGE_ROOT_KEYWORD + SEPARATOR + String.join(SEPARATOR, segments.subList(1, segments.size()));
        }
        return SEPARATOR + String.join(SEPARATOR, segments);
    }

    @Override
    public int compareTo(ItemPath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int result = segments.get(i).compareTo(other.segments.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
