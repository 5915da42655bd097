package org.pivotgrid.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP controller mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers the controller's routes.
     *
     * @param app      the Javalin application
     * @param basePath path prefix derived from the controller's position in the routes tree
     */
    void registerRoutes(Javalin app, String basePath);
}
