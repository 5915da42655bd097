package org.pivotgrid.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.pivotgrid.node.spi.IProcess;
import org.pivotgrid.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hosts the processes configured under {@code node.processes}.
 *
 * <pre>
 * node.processes {
 *   pivotEngine { className = "...PivotEngineProcess", options { ... } }
 *   httpServer {
 *     className = "...HttpServerProcess"
 *     require { pivotService = "pivotEngine" }
 *     options { ... }
 *   }
 * }
 * </pre>
 *
 * <p>Processes are instantiated so that every process comes after the processes it requires;
 * each required process's exposed service is injected under the local name of the
 * {@code require} entry. Processes are started in that order and stopped in reverse.</p>
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";

    private final Map<String, IProcess> processes = new LinkedHashMap<>();
    private Thread shutdownHook;
    private boolean running;

    /**
     * Instantiates all configured processes.
     *
     * @throws IllegalStateException if a process definition is invalid, a dependency cannot be
     *                               resolved or a process fails to construct
     */
    public Node(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            LOGGER.warn("No '{}' configured, the node will be idle.", PROCESSES_PATH);
            return;
        }
        final Map<String, ProcessDefinition> definitions = parse(config.getObject(PROCESSES_PATH));
        final Map<String, Object> services = new HashMap<>();
        for (final String name : dependencyOrder(definitions)) {
            final ProcessDefinition definition = definitions.get(name);
            final IProcess process = instantiate(definition, resolveDependencies(definition, services));
            processes.put(name, process);
            if (process instanceof IServiceProvider) {
                final Object service = ((IServiceProvider) process).getExposedService();
                if (service != null) {
                    services.put(name, service);
                }
            }
        }
        LOGGER.info("Initialized processes {}", processes.keySet());
    }

    /**
     * Starts all processes and registers a shutdown hook that stops them.
     *
     * @throws IllegalStateException if a process fails to start; processes already started are
     *                               stopped again
     */
    public synchronized void start() {
        final List<String> started = new ArrayList<>();
        for (final Map.Entry<String, IProcess> entry : processes.entrySet()) {
            try {
                entry.getValue().start();
                started.add(entry.getKey());
                LOGGER.debug("Started process '{}'", entry.getKey());
            } catch (final RuntimeException e) {
                LOGGER.error("Process '{}' failed to start, stopping the node.", entry.getKey(), e);
                stopAll(started);
                throw new IllegalStateException("Process '" + entry.getKey() + "' failed to start", e);
            }
        }
        running = true;
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started.");
    }

    /**
     * Stops all processes in reverse start order. Safe to call more than once.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("JVM already shutting down: {}", e.getMessage());
            }
        }
        stopAll(new ArrayList<>(processes.keySet()));
        LOGGER.info("Node stopped.");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Looks up a process by its configured name.
     */
    public <T extends IProcess> Optional<T> getProcess(final String name, final Class<T> type) {
        final IProcess process = processes.get(name);
        return type.isInstance(process) ? Optional.of(type.cast(process)) : Optional.empty();
    }

    public List<String> getProcessNames() {
        return List.copyOf(processes.keySet());
    }

    private void stopAll(final List<String> names) {
        final List<String> reversed = new ArrayList<>(names);
        Collections.reverse(reversed);
        for (final String name : reversed) {
            try {
                processes.get(name).stop();
                LOGGER.debug("Stopped process '{}'", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
    }

    private static Map<String, ProcessDefinition> parse(final ConfigObject processesConfig) {
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        final Config all = processesConfig.toConfig();
        for (final String name : processesConfig.keySet()) {
            final Config process = all.getConfig(quoted(name));
            if (!process.hasPath("className")) {
                throw new IllegalStateException("Process '" + name + "' has no className.");
            }
            final Map<String, String> requires = new LinkedHashMap<>();
            if (process.hasPath("require")) {
                final Config require = process.getConfig("require");
                process.getObject("require").keySet()
                    .forEach(local -> requires.put(local, require.getString(quoted(local))));
            }
            definitions.put(name, new ProcessDefinition(
                name,
                process.getString("className"),
                process.hasPath("options") ? process.getConfig("options") : ConfigFactory.empty(),
                requires));
        }
        return definitions;
    }

    /**
     * Orders processes so that each one follows everything it requires (Kahn's algorithm).
     * Independent processes keep their configuration order.
     */
    static List<String> dependencyOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> pending = new LinkedHashMap<>();
        final Map<String, List<String>> dependents = new HashMap<>();
        for (final ProcessDefinition definition : definitions.values()) {
            pending.put(definition.name(), definition.requires().size());
            for (final String required : definition.requires().values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name() + "' requires '" + required
                        + "', which is not configured.");
                }
                dependents.computeIfAbsent(required, k -> new ArrayList<>()).add(definition.name());
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        pending.forEach((name, count) -> {
            if (count == 0) {
                ready.add(name);
            }
        });
        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String name = ready.poll();
            order.add(name);
            for (final String dependent : dependents.getOrDefault(name, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != definitions.size()) {
            final List<String> cyclic = new ArrayList<>(definitions.keySet());
            cyclic.removeAll(order);
            throw new IllegalStateException("Circular dependency among processes " + cyclic);
        }
        return order;
    }

    private static Map<String, Object> resolveDependencies(final ProcessDefinition definition,
                                                           final Map<String, Object> services) {
        final Map<String, Object> resolved = new HashMap<>();
        definition.requires().forEach((local, source) -> {
            final Object service = services.get(source);
            if (service == null) {
                throw new IllegalStateException("Process '" + definition.name() + "' requires a service from '"
                    + source + "', which exposes none.");
            }
            resolved.put(local, service);
        });
        return resolved;
    }

    private static IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> dependencies) {
        try {
            final Class<?> type = Class.forName(definition.className());
            if (!IProcess.class.isAssignableFrom(type)) {
                throw new IllegalStateException(definition.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = type.getConstructor(String.class, Map.class, Config.class);
            LOGGER.debug("Instantiating process '{}' ({})", definition.name(), definition.className());
            return (IProcess) constructor.newInstance(definition.name(), dependencies, definition.options());
        } catch (final InvocationTargetException e) {
            throw new IllegalStateException("Process '" + definition.name() + "' failed to initialize: "
                + e.getCause().getMessage(), e.getCause());
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate process '" + definition.name() + "' from "
                + definition.className(), e);
        }
    }

    private static String quoted(final String key) {
        return "\"" + key + "\"";
    }

    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}
