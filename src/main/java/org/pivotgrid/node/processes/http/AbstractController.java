package org.pivotgrid.node.processes.http;

import com.typesafe.config.Config;
import org.pivotgrid.node.spi.IController;
import org.pivotgrid.node.spi.ServiceRegistry;

/**
 * Base class of controllers. Controllers are constructed reflectively with the registry of
 * services and their own {@code options} block.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path from the routes tree with a relative route.
     */
    protected static String path(final String basePath, final String route) {
        return (basePath + "/" + route).replaceAll("/{2,}", "/");
    }
}
