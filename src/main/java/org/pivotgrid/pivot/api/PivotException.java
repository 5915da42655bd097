package org.pivotgrid.pivot.api;

/**
 * Raised by every stage of the pivot pipeline. The {@link PivotErrorKind} tells callers whether
 * the request was at fault and which HTTP status to answer with.
 */
public class PivotException extends RuntimeException {

    private final PivotErrorKind kind;

    public PivotException(final PivotErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public PivotException(final PivotErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public PivotErrorKind getKind() {
        return kind;
    }

    public static PivotException unknownDataset(final String dataset) {
        return new PivotException(PivotErrorKind.UNKNOWN_DATASET, "Unknown dataset: " + dataset);
    }

    public static PivotException unknownField(final String dataset, final String fieldId) {
        return new PivotException(PivotErrorKind.UNKNOWN_FIELD,
            "Unknown field '" + fieldId + "' in dataset '" + dataset + "'");
    }

    public static PivotException invalidFilterValue(final String message) {
        return new PivotException(PivotErrorKind.INVALID_FILTER_VALUE, message);
    }

    public static PivotException compilationFailed(final String message) {
        return new PivotException(PivotErrorKind.QUERY_COMPILATION_FAILED, message);
    }

    public static PivotException executionFailed(final String message, final Throwable cause) {
        return new PivotException(PivotErrorKind.QUERY_EXECUTION_FAILED, message, cause);
    }

    public static PivotException cacheKeyNotFound(final String fingerprint) {
        return new PivotException(PivotErrorKind.CACHE_KEY_NOT_FOUND,
            "No cached pivot for fingerprint " + fingerprint + "; it may have expired");
    }

    public static PivotException resultTooLarge(final String message) {
        return new PivotException(PivotErrorKind.RESULT_TOO_LARGE, message);
    }
}
