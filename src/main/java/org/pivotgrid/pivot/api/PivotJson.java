package org.pivotgrid.pivot.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson setup shared by the HTTP layer, the CLI and fingerprinting.
 */
public final class PivotJson {

    private PivotJson() {
        // utility class
    }

    /**
     * Returns a new mapper that ignores unknown request properties such as paging hints sent by
     * older clients.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
