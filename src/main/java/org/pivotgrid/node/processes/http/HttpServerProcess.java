package org.pivotgrid.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.pivotgrid.node.processes.AbstractProcess;
import org.pivotgrid.node.spi.IController;
import org.pivotgrid.node.spi.ServiceRegistry;
import org.pivotgrid.pivot.api.PivotJson;
import org.pivotgrid.pivot.service.PivotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serves the HTTP API with Javalin. Controllers are mounted from the {@code routes} tree: every
 * {@code "$controller"} block names a controller class, and its position in the tree is the
 * controller's base path.
 *
 * <pre>
 * options {
 *   network { host = "0.0.0.0", port = 8000, threadPool { minThreads = 8, maxThreads = 200, idleTimeoutMs = 60000 } }
 *   cors.allowedOrigins = ["*"]
 *   routes {
 *     api.pivot { "$controller" { className = "org.pivotgrid.node.processes.http.api.pivot.PivotController" } }
 *   }
 * }
 * </pre>
 *
 * Requires the {@code pivotService} dependency.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);
    private static final String CONTROLLER_KEY = "$controller";

    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private final List<ControllerRoute> controllerRoutes = new ArrayList<>();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        controllerRegistry.register(PivotService.class, getDependency("pivotService", PivotService.class));
        if (options.hasPath("routes")) {
            collectControllers(options.getObject("routes"), "/");
        } else {
            LOGGER.warn("No routes configured for '{}', the server will answer 404 only.", processName);
        }
    }

    @Override
    public synchronized void start() {
        if (app != null) {
            LOGGER.warn("HTTP server '{}' is already running.", processName);
            return;
        }
        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8000;
        final List<String> allowedOrigins = options.hasPath("cors.allowedOrigins")
            ? options.getStringList("cors.allowedOrigins")
            : List.of();

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(PivotJson.newObjectMapper(), false));
            config.requestLogger.http((ctx, ms) ->
                LOGGER.debug("{} {} -> {} in {} ms", ctx.method(), ctx.path(), ctx.status().getCode(), ms));
            config.jetty.threadPool = threadPool();
            if (!allowedOrigins.isEmpty()) {
                config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                    if (allowedOrigins.contains("*")) {
                        rule.anyHost();
                    } else {
                        allowedOrigins.forEach(origin -> rule.allowHost(origin));
                    }
                }));
            }
        });

        for (final ControllerRoute route : controllerRoutes) {
            instantiate(route).registerRoutes(app, route.basePath());
            LOGGER.debug("Mounted {} at '{}'", route.className(), route.basePath());
        }

        app.start(host, port);
        LOGGER.info("HTTP server listening on {}:{}", host, app.port());
    }

    @Override
    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server '{}' stopped.", processName);
        }
    }

    /**
     * @return the bound port, or -1 if the server is not running
     */
    public synchronized int getPort() {
        return app != null ? app.port() : -1;
    }

    private QueuedThreadPool threadPool() {
        final int minThreads = options.hasPath("network.threadPool.minThreads")
            ? options.getInt("network.threadPool.minThreads") : 8;
        final int maxThreads = options.hasPath("network.threadPool.maxThreads")
            ? options.getInt("network.threadPool.maxThreads") : 200;
        final int idleTimeoutMs = options.hasPath("network.threadPool.idleTimeoutMs")
            ? options.getInt("network.threadPool.idleTimeoutMs") : 60_000;
        final QueuedThreadPool pool = new QueuedThreadPool(maxThreads, minThreads, idleTimeoutMs);
        pool.setName(processName);
        return pool;
    }

    private void collectControllers(final ConfigObject level, final String path) {
        for (final Map.Entry<String, ConfigValue> entry : level.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                throw new IllegalArgumentException("Route entry '" + entry.getKey() + "' at '" + path
                    + "' must be an object.");
            }
            if (CONTROLLER_KEY.equals(entry.getKey())) {
                final Config controller = ((ConfigObject) value).toConfig();
                controllerRoutes.add(new ControllerRoute(
                    path,
                    controller.getString("className"),
                    controller.hasPath("options") ? controller.getConfig("options") : ConfigFactory.empty()));
            } else {
                collectControllers((ConfigObject) value, path + entry.getKey() + "/");
            }
        }
    }

    private IController instantiate(final ControllerRoute route) {
        try {
            final Class<?> type = Class.forName(route.className());
            if (!IController.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(route.className() + " does not implement IController.");
            }
            return (IController) type.getConstructor(ServiceRegistry.class, Config.class)
                .newInstance(controllerRegistry, route.options());
        } catch (final InvocationTargetException e) {
            throw new IllegalStateException("Controller " + route.className() + " failed to initialize", e.getCause());
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate controller " + route.className(), e);
        }
    }

    private record ControllerRoute(String basePath, String className, Config options) {
    }
}
