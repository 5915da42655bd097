package org.pivotgrid.node.processes.http.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.HttpStatus;
import org.pivotgrid.node.processes.http.AbstractController;
import org.pivotgrid.node.processes.http.api.dto.ErrorResponseDto;
import org.pivotgrid.node.spi.ServiceRegistry;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotResponse;
import org.pivotgrid.pivot.service.PivotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the controllers backed by the {@link PivotService}. Provides the shared
 * exception mapping:
 * <ul>
 *   <li>{@link PivotException}: the status of its kind, body {@link PivotResponse} with {@code error}</li>
 *   <li>malformed JSON and bad parameters: 400 {@link ErrorResponseDto}</li>
 *   <li>anything else: 500 {@link ErrorResponseDto}</li>
 * </ul>
 */
public abstract class PivotApiController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotApiController.class);

    protected final PivotService pivotService;

    protected PivotApiController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.pivotService = registry.get(PivotService.class);
    }

    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(PivotException.class, (e, ctx) -> {
            final int status = e.getKind().httpStatus();
            if (status >= 500) {
                LOGGER.warn("{} for {}: {}", e.getKind().tag(), ctx.path(), e.getMessage());
            } else {
                LOGGER.debug("{} for {}: {}", e.getKind().tag(), ctx.path(), e.getMessage());
            }
            ctx.status(status).json(PivotResponse.failure(e));
        });
        app.exception(JsonProcessingException.class, (e, ctx) -> {
            LOGGER.debug("Malformed body for {}: {}", ctx.path(), e.getOriginalMessage());
            ctx.status(HttpStatus.BAD_REQUEST)
                .json(ErrorResponseDto.of(HttpStatus.BAD_REQUEST, "Malformed request: " + e.getOriginalMessage()));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Invalid request for {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(HttpStatus.BAD_REQUEST, e.getMessage()));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .json(ErrorResponseDto.of(HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred"));
        });
    }
}
