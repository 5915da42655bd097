package org.pivotgrid.node.processes.http.api.pivot;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.pivotgrid.node.processes.http.api.PivotApiController;
import org.pivotgrid.node.spi.ServiceRegistry;
import org.pivotgrid.pivot.api.DrillRequest;
import org.pivotgrid.pivot.api.PivotRequest;

/**
 * Pivot computation and drill endpoints.
 * <ul>
 *   <li>{@code POST <base>/compute} with a {@link PivotRequest} body</li>
 *   <li>{@code POST <base>/drill} with a {@link DrillRequest} body</li>
 * </ul>
 * Both answer with a {@code PivotResponse}.
 */
public class PivotController extends PivotApiController {

    public PivotController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, "compute"), this::compute);
        app.post(path(basePath, "drill"), this::drill);
        setupExceptionHandlers(app);
    }

    void compute(final Context ctx) {
        final PivotRequest request = ctx.bodyAsClass(PivotRequest.class);
        ctx.status(HttpStatus.OK).json(pivotService.computePivot(request));
    }

    void drill(final Context ctx) {
        final DrillRequest request = ctx.bodyAsClass(DrillRequest.class);
        ctx.status(HttpStatus.OK).json(pivotService.drill(request));
    }
}
