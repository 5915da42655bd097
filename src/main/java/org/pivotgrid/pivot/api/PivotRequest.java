package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A complete pivot request: dataset, layout and the expansion state of both axes.
 * Path elements may be {@code null}, which addresses a group whose key is SQL NULL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotRequest(
    String dataset,
    PivotConfiguration configuration,
    Set<List<String>> expandedPaths,
    Set<List<String>> expandedColumnPaths
) {

    public PivotRequest {
        Objects.requireNonNull(dataset, "dataset is required");
        Objects.requireNonNull(configuration, "configuration is required");
        expandedPaths = copyPaths(expandedPaths);
        expandedColumnPaths = copyPaths(expandedColumnPaths);
    }

    public PivotRequest(final String dataset, final PivotConfiguration configuration) {
        this(dataset, configuration, Set.of(), Set.of());
    }

    /**
     * Returns a copy of this request with the given row expansion state.
     */
    public PivotRequest withExpandedPaths(final Set<List<String>> paths) {
        return new PivotRequest(dataset, configuration, paths, expandedColumnPaths);
    }

    /**
     * Returns a copy of this request with the given column expansion state.
     */
    public PivotRequest withExpandedColumnPaths(final Set<List<String>> paths) {
        return new PivotRequest(dataset, configuration, expandedPaths, paths);
    }

    /**
     * Copies a path into an immutable list. Unlike {@link List#copyOf(Collection)} this keeps
     * {@code null} elements.
     */
    public static List<String> copyPath(final Collection<String> path) {
        return Collections.unmodifiableList(new ArrayList<>(path));
    }

    private static Set<List<String>> copyPaths(final Set<List<String>> paths) {
        if (paths == null || paths.isEmpty()) {
            return Set.of();
        }
        final Set<List<String>> copy = new LinkedHashSet<>();
        for (final List<String> path : paths) {
            copy.add(copyPath(Objects.requireNonNull(path, "expanded path must not be null")));
        }
        return Collections.unmodifiableSet(copy);
    }
}
