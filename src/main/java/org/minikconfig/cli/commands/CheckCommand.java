package org.minikconfig.cli.commands;

import org.minikconfig.MiniKconfig;
import org.minikconfig.api.KconfigException;
import org.minikconfig.cli.CommandLineInterface;
import org.minikconfig.config.MiniKconfigSettings;
import org.minikconfig.diagnostics.Diagnostic;
import org.minikconfig.model.SymbolTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Parses and resolves a Kconfig description and prints every diagnostic"
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "The root Kconfig file (default: minikconfig.input, \"Kconfig\")"
    )
    private Path kconfig;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final MiniKconfigSettings settings = MiniKconfigSettings.from(parent.getConfig());
        final Path input = kconfig != null ? kconfig : Path.of(settings.input());
        final PrintWriter out = spec.commandLine().getOut();

        final MiniKconfig miniKconfig = new MiniKconfig();
        final SymbolTable table;
        try {
            table = miniKconfig.parse(input);
        } catch (KconfigException e) {
            spec.commandLine().getErr().println("Error checking " + input + ": " + e.getMessage());
            return 1;
        }
        miniKconfig.resolve(table);

        for (final Diagnostic diagnostic : miniKconfig.getDiagnostics().getDiagnostics()) {
            out.println(diagnostic);
        }
        out.printf("%d symbols, %d menus, %d diagnostics%n",
                table.size(), table.getMenus().size(), miniKconfig.getDiagnostics().getDiagnostics().size());
        out.flush();

        return miniKconfig.getDiagnostics().hasErrors() ? 2 : 0;
    }
}
