package org.pivotgrid.node.processes.http.api.dataset;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.pivotgrid.node.processes.http.api.PivotApiController;
import org.pivotgrid.node.spi.ServiceRegistry;
import org.pivotgrid.pivot.api.PivotValue;

import java.util.List;

/**
 * Dataset discovery for building pivot configurations and filter pickers.
 * <ul>
 *   <li>{@code GET <base>/{dataset}/fields}: the dataset's fields</li>
 *   <li>{@code GET <base>/{dataset}/fields/{fieldId}/values?limit=}: distinct values of a field</li>
 * </ul>
 */
public class DatasetController extends PivotApiController {

    public DatasetController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, "{dataset}/fields"), this::getFields);
        app.get(path(basePath, "{dataset}/fields/{fieldId}/values"), this::getFieldValues);
        setupExceptionHandlers(app);
    }

    void getFields(final Context ctx) {
        ctx.json(pivotService.listFields(ctx.pathParam("dataset")));
    }

    void getFieldValues(final Context ctx) {
        final String limitParam = ctx.queryParam("limit");
        final Integer limit;
        try {
            limit = limitParam != null ? Integer.valueOf(limitParam) : null;
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer, got '" + limitParam + "'", e);
        }
        final List<PivotValue> values =
            pivotService.listFieldValues(ctx.pathParam("dataset"), ctx.pathParam("fieldId"), limit);
        ctx.json(values);
    }
}
