package org.pivotgrid.cli.commands.node;

import org.pivotgrid.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node in the foreground until interrupted."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Node node = new Node(parent.getParent().getConfig(spec.commandLine()));
        node.start();
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            LOGGER.info("Interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } finally {
            node.stop();
        }
        return 0;
    }
}
