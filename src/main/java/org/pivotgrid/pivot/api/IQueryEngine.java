package org.pivotgrid.pivot.api;

/**
 * Executes compiled queries against the underlying relational engine.
 */
public interface IQueryEngine {

    /**
     * Runs the query and returns all rows it produces.
     *
     * @param query the compiled statement
     * @return the flat result
     * @throws PivotException with {@link PivotErrorKind#QUERY_EXECUTION_FAILED} on any engine error
     */
    QueryResult execute(CompiledQuery query);
}
