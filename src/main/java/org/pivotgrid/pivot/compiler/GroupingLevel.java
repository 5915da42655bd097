package org.pivotgrid.pivot.compiler;

/**
 * A grouping granularity: the number of leading row fields and leading column fields grouped by.
 * {@code (0, 0)} is the grand total, {@code (R, C)} the leaf level.
 */
public record GroupingLevel(int rowDepth, int columnDepth) implements Comparable<GroupingLevel> {

    @Override
    public int compareTo(final GroupingLevel other) {
        final int byRows = Integer.compare(rowDepth, other.rowDepth);
        return byRows != 0 ? byRows : Integer.compare(columnDepth, other.columnDepth);
    }

    @Override
    public String toString() {
        return "(" + rowDepth + "," + columnDepth + ")";
    }
}
