package org.pivotgrid.pivot.materializer;

import org.pivotgrid.pivot.api.CellType;

import java.util.List;

/**
 * One rendered row, or one rendered column group before it is split per measure.
 */
record AxisUnit(Kind kind, AxisNode node) {

    enum Kind {
        /** A visible hierarchy node: a leaf, or a collapsed node showing its aggregate. */
        NODE,
        /** The trailing total of an expanded node. */
        SUBTOTAL,
        /** The total over the whole axis. */
        GRAND_TOTAL,
        /** The single slot of an axis without grouping fields. */
        ALL
    }

    /**
     * @return the grouping depth whose aggregates this unit shows
     */
    int valueDepth() {
        return kind == Kind.NODE || kind == Kind.SUBTOTAL ? node.depth() : 0;
    }

    List<String> path() {
        return kind == Kind.NODE || kind == Kind.SUBTOTAL ? node.path() : List.of();
    }

    /**
     * @return the header level carrying this unit's own label, -1 if it has none
     */
    int labelLevel() {
        return switch (kind) {
            case NODE -> node.depth() - 1;
            case SUBTOTAL -> node.depth();
            case GRAND_TOTAL -> 0;
            case ALL -> -1;
        };
    }

    CellType cellType(final int axisDepth, final boolean showSubtotals) {
        return switch (kind) {
            case NODE -> node.depth() < axisDepth && showSubtotals ? CellType.SUBTOTAL : CellType.DATA;
            case SUBTOTAL -> CellType.SUBTOTAL;
            case GRAND_TOTAL -> CellType.GRAND_TOTAL;
            case ALL -> CellType.DATA;
        };
    }
}
