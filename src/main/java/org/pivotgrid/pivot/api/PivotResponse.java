package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PivotResponse(PivotStructure structure, PivotMetadata metadata, boolean hasMore, PivotError error) {

    public static PivotResponse success(final PivotStructure structure, final PivotMetadata metadata, final boolean hasMore) {
        return new PivotResponse(structure, metadata, hasMore, null);
    }

    public static PivotResponse failure(final PivotException e) {
        return new PivotResponse(null, null, false, PivotError.of(e));
    }
}
