package org.pivotgrid.node.processes;

import com.typesafe.config.Config;
import org.pivotgrid.node.spi.IServiceProvider;
import org.pivotgrid.pivot.service.PivotEngine;
import org.pivotgrid.pivot.service.PivotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs the pivot engine inside the node and exposes its {@link PivotService} to dependent
 * processes. The options block is the engine configuration described in {@link PivotEngine}.
 */
public class PivotEngineProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotEngineProcess.class);

    private final PivotEngine engine;

    public PivotEngineProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.engine = PivotEngine.create(processName, options);
    }

    @Override
    public void start() {
        engine.start();
        LOGGER.info("Pivot engine '{}' started (cache ttl {}, max {} entries)",
            processName, engine.getCache().getTtl(), engine.getCache().getMaxEntries());
    }

    @Override
    public void stop() {
        engine.close();
        LOGGER.info("Pivot engine '{}' stopped.", processName);
    }

    @Override
    public Object getExposedService() {
        return engine.getService();
    }

    PivotEngine getEngine() {
        return engine;
    }
}
