package org.pivotgrid.cli.commands;

import com.typesafe.config.Config;
import org.pivotgrid.pivot.service.PivotEngine;
import picocli.CommandLine;

/**
 * Builds a standalone pivot engine for one-shot commands from the options of a configured
 * engine process.
 */
final class EngineCommandSupport {

    private EngineCommandSupport() {
        // utility class
    }

    static PivotEngine openEngine(final Config config, final String processName, final CommandLine commandLine) {
        final String path = "node.processes." + processName + ".options";
        if (!config.hasPath(path)) {
            throw new CommandLine.ParameterException(commandLine,
                "No engine process '" + processName + "' configured (expected '" + path + "').");
        }
        return PivotEngine.create(processName, config.getConfig(path));
    }
}
