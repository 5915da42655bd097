package org.pivotgrid.node.processes.http.api.health;

import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotgrid.node.spi.ServiceRegistry;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class HealthControllerTest {

    @Test
    void reportsOkWithVersionAndUptime() {
        HealthController controller = new HealthController(new ServiceRegistry(), ConfigFactory.empty());
        Javalin app = Javalin.create();
        controller.registerRoutes(app, "/health/");

        JavalinTest.test(app, (server, client) -> {
            var response = client.get("/health");
            assertThat(response.code()).isEqualTo(200);
            String json = response.body().string();
            assertThat(json).contains("\"status\":\"ok\"");
            // no manifest when running from classes
            assertThat(json).contains("\"version\":\"dev\"");
            assertThat(json).contains("\"uptimeSeconds\":");
        });
    }
}
