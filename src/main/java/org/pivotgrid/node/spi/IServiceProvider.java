package org.pivotgrid.node.spi;

/**
 * A process that offers a service to the processes declaring it in their {@code require} block.
 */
public interface IServiceProvider {

    /**
     * @return the service handed to dependent processes, or {@code null} if there is none
     */
    Object getExposedService();
}
