package org.minikconfig.cli.commands;

import org.minikconfig.MiniKconfig;
import org.minikconfig.api.KconfigException;
import org.minikconfig.cli.CommandLineInterface;
import org.minikconfig.config.MiniKconfigSettings;
import org.minikconfig.diagnostics.Diagnostic;
import org.minikconfig.model.SymbolTable;
import org.minikconfig.output.JsonModelWriter;
import org.minikconfig.selection.SelectionRequestReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "inspect",
    description = "Prints the resolved symbol graph as JSON"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "The root Kconfig file (default: minikconfig.input, \"Kconfig\")"
    )
    private Path kconfig;

    @Option(
        names = {"-s", "--select"},
        description = "Comma-separated list of configs to select before printing"
    )
    private List<String> selectionLists = new ArrayList<>();

    @Option(
        names = {"-d", "--no-defaults"},
        description = "Do not select symbols declared with 'default y'"
    )
    private boolean noDefaults;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final MiniKconfigSettings settings = MiniKconfigSettings.from(parent.getConfig());
        final Path input = kconfig != null ? kconfig : Path.of(settings.input());
        final PrintWriter err = spec.commandLine().getErr();

        final MiniKconfig miniKconfig = new MiniKconfig();
        try {
            final SymbolTable table = miniKconfig.parse(input);
            miniKconfig.resolve(table);
            miniKconfig.fixDependencies(table);
            if (!noDefaults && settings.selectDefaults()) {
                miniKconfig.selectDefaults(table);
            }
            miniKconfig.selectConfigs(table, selections());

            final PrintWriter out = spec.commandLine().getOut();
            new JsonModelWriter().write(table, out);
        } catch (KconfigException | IOException e) {
            err.println("Error inspecting " + input + ": " + e.getMessage());
            return 1;
        }

        // Diagnostics go to stderr so that stdout stays valid JSON.
        for (final Diagnostic diagnostic : miniKconfig.getDiagnostics().getDiagnostics()) {
            err.println(diagnostic);
        }
        err.flush();
        return 0;
    }

    private List<String> selections() {
        final List<String> names = new ArrayList<>();
        for (final String list : selectionLists) {
            names.addAll(SelectionRequestReader.parseList(list));
        }
        return names;
    }
}
