package org.pivotgrid.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.pivotgrid.cli.CommandLineInterface;
import org.pivotgrid.pivot.api.PivotException;
import org.pivotgrid.pivot.api.PivotJson;
import org.pivotgrid.pivot.api.PivotRequest;
import org.pivotgrid.pivot.api.PivotResponse;
import org.pivotgrid.pivot.service.PivotEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "compute",
    description = "Computes one pivot request and prints the response as JSON."
)
public class ComputeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-r", "--request"}, required = true, description = "JSON file holding the pivot request")
    private File requestFile;

    @Option(names = "--engine", defaultValue = "pivotEngine",
        description = "Name of the engine process whose options to use (default: ${DEFAULT-VALUE})")
    private String engineName;

    @Option(names = "--pretty", description = "Pretty-print the response")
    private boolean pretty;

    @Override
    public Integer call() throws IOException {
        final ObjectMapper mapper = PivotJson.newObjectMapper();
        final PivotRequest request = mapper.readValue(requestFile, PivotRequest.class);

        PivotResponse response;
        try (PivotEngine engine = EngineCommandSupport.openEngine(
                parent.getConfig(spec.commandLine()), engineName, spec.commandLine())) {
            response = engine.getService().computePivot(request);
        } catch (final PivotException e) {
            response = PivotResponse.failure(e);
        }

        final String json = pretty
            ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response)
            : mapper.writeValueAsString(response);
        spec.commandLine().getOut().println(json);
        spec.commandLine().getOut().flush();
        return response.error() == null ? 0 : 2;
    }
}
