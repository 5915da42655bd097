package org.pivotgrid.cli.commands;

import org.pivotgrid.cli.CommandLineInterface;
import org.pivotgrid.pivot.api.Field;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.service.PivotEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "fields",
    description = "Lists the fields of a dataset."
)
public class FieldsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Dataset (table) name")
    private String dataset;

    @Option(names = "--engine", defaultValue = "pivotEngine",
        description = "Name of the engine process whose options to use (default: ${DEFAULT-VALUE})")
    private String engineName;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        try (PivotEngine engine = EngineCommandSupport.openEngine(
                parent.getConfig(spec.commandLine()), engineName, spec.commandLine())) {
            final List<Field> fields = engine.getService().listFields(dataset);
            out.printf("%-24s %-24s %-8s%n", "ID", "NAME", "TYPE");
            for (final Field field : fields) {
                out.printf("%-24s %-24s %-8s%n", field.id(), field.name(), field.dataType().wireName());
            }
            out.flush();
            return 0;
        } catch (final PivotException e) {
            spec.commandLine().getErr().println(e.getKind().tag() + ": " + e.getMessage());
            return 2;
        }
    }
}
