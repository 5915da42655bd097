package org.pivotgrid.node.processes.http.api.health;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.pivotgrid.node.processes.http.AbstractController;
import org.pivotgrid.node.spi.ServiceRegistry;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness probe at {@code GET <base>}.
 */
public class HealthController extends AbstractController {

    private final Instant startedAt = Instant.now();
    private final String version;

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        final String implementationVersion = HealthController.class.getPackage().getImplementationVersion();
        this.version = implementationVersion != null ? implementationVersion : "dev";
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String route = basePath.length() > 1 && basePath.endsWith("/")
            ? basePath.substring(0, basePath.length() - 1)
            : basePath;
        app.get(route, this::getHealth);
    }

    void getHealth(final Context ctx) {
        ctx.json(new HealthDto("ok", version, Duration.between(startedAt, Instant.now()).toSeconds()));
    }

    /**
     * @param status        always {@code ok} while the server answers
     * @param version       implementation version of the running build
     * @param uptimeSeconds seconds since the controller was mounted
     */
    public record HealthDto(String status, String version, long uptimeSeconds) {
    }
}
