package org.pivotgrid.node.spi;

/**
 * A component with a lifecycle managed by the {@link org.pivotgrid.node.Node}.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; long-running work belongs on the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}
