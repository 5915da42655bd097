package org.pivotgrid.pivot.api;

/**
 * Error taxonomy of the pivot pipeline with the HTTP status each kind maps to.
 */
public enum PivotErrorKind {
    UNKNOWN_DATASET("UnknownDataset", 404),
    UNKNOWN_FIELD("UnknownField", 400),
    INVALID_FILTER_VALUE("InvalidFilterValue", 400),
    QUERY_COMPILATION_FAILED("QueryCompilationFailed", 500),
    QUERY_EXECUTION_FAILED("QueryExecutionFailed", 500),
    CACHE_KEY_NOT_FOUND("CacheKeyNotFound", 404),
    RESULT_TOO_LARGE("ResultTooLarge", 413);

    private final String tag;
    private final int httpStatus;

    PivotErrorKind(final String tag, final int httpStatus) {
        this.tag = tag;
        this.httpStatus = httpStatus;
    }

    public String tag() {
        return tag;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
