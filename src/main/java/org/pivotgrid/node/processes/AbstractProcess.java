package org.pivotgrid.node.processes;

import com.typesafe.config.Config;
import org.pivotgrid.node.spi.IProcess;

import java.util.Map;

/**
 * Base class of node processes. Every process is constructed reflectively with its name, the
 * services of the processes it requires and its {@code options} block.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * @throws IllegalArgumentException if the dependency is missing or of another type
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dependency = getOptionalDependency(name, expectedType);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        return dependency;
    }

    /**
     * @return the dependency, or {@code null} if it was not declared
     * @throws IllegalArgumentException if the dependency is of another type
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            return null;
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException(String.format("Dependency '%s' for process '%s' is %s but expected %s",
                name, processName, dependency.getClass().getName(), expectedType.getName()));
        }
        return expectedType.cast(dependency);
    }
}
