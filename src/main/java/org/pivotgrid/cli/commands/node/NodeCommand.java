package org.pivotgrid.cli.commands.node;

import org.pivotgrid.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Runs the pivotgrid node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {

    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
