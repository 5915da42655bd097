package org.pivotgrid.pivot.api;

/**
 * Wire form of a failed pivot computation.
 */
public record PivotError(String kind, String message) {

    public static PivotError of(final PivotException e) {
        return new PivotError(e.getKind().tag(), e.getMessage());
    }
}
