package org.pivotgrid.pivot.api;

/**
 * Closed catalog of datasets and their typed fields.
 */
public interface IFieldCatalog {

    /**
     * Describes a dataset.
     *
     * @param dataset the dataset id
     * @return the dataset's table and ordered fields
     * @throws PivotException with {@link PivotErrorKind#UNKNOWN_DATASET} if no such dataset exists
     */
    DatasetSchema describe(String dataset);
}
