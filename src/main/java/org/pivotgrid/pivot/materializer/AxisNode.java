package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotValue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a row or column hierarchy. The root has depth 0 and an empty path; a node at depth
 * {@code d} is identified by the first {@code d} group keys of the axis.
 *
 * <p>Nodes use identity equality.</p>
 */
final class AxisNode {

    private final AxisNode parent;
    private final PivotValue key;
    private final List<String> path;
    private final Map<String, AxisNode> children = new LinkedHashMap<>();
    private final BitSet leafRows = new BitSet();

    private AxisNode(final AxisNode parent, final PivotValue key, final List<String> path) {
        this.parent = parent;
        this.key = key;
        this.path = path;
    }

    /**
     * Builds the hierarchy of one axis from the leaf result rows.
     *
     * @param rows     leaf rows
     * @param offset   index of the axis' first key column
     * @param depth    number of key columns of the axis
     * @param sortKeys whether to order children by {@link PivotValue#KEY_ORDER}; otherwise they keep
     *                 the order in which the rows first present them
     * @return the root node
     */
    static AxisNode build(final List<List<PivotValue>> rows, final int offset, final int depth,
                          final boolean sortKeys) {
        final AxisNode root = new AxisNode(null, null, List.of());
        for (int i = 0; i < rows.size(); i++) {
            final List<PivotValue> row = rows.get(i);
            AxisNode node = root;
            node.leafRows.set(i);
            for (int d = 0; d < depth; d++) {
                node = node.child(row.get(offset + d));
                node.leafRows.set(i);
            }
        }
        if (sortKeys) {
            root.sortChildren();
        }
        return root;
    }

    private AxisNode child(final PivotValue childKey) {
        final String element = childKey.toPathElement();
        AxisNode child = children.get(element);
        if (child == null) {
            final List<String> childPath = new ArrayList<>(path);
            childPath.add(element);
            child = new AxisNode(this, childKey, PivotRequest.copyPath(childPath));
            children.put(element, child);
        }
        return child;
    }

    private void sortChildren() {
        if (children.isEmpty()) {
            return;
        }
        final List<AxisNode> sorted = new ArrayList<>(children.values());
        sorted.sort((a, b) -> PivotValue.KEY_ORDER.compare(a.key, b.key));
        children.clear();
        for (final AxisNode child : sorted) {
            children.put(child.path.get(child.path.size() - 1), child);
            child.sortChildren();
        }
    }

    PivotValue key() {
        return key;
    }

    List<String> path() {
        return path;
    }

    int depth() {
        return path.size();
    }

    Collection<AxisNode> children() {
        return children.values();
    }

    BitSet leafRows() {
        return leafRows;
    }

    /**
     * @return this node or its ancestor at the given depth
     */
    AxisNode ancestorAt(final int depth) {
        AxisNode node = this;
        while (node.depth() > depth) {
            node = node.parent;
        }
        return node;
    }
}
