package org.minikconfig.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.minikconfig.model.Menu;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolKind;
import org.minikconfig.model.SymbolTable;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dumps the parsed graph as pretty-printed JSON, for inspection and tooling.
 * Menus are written as a tree; symbols are listed in declaration order with their
 * resolved edges and selection flags.
 */
public class JsonModelWriter implements IConfigWriter {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @Override
    public void write(SymbolTable table, Writer out) throws IOException {
        ModelView view = new ModelView(
                table.getMainMenuTitle(),
                table.getMenus().stream()
                        .filter(m -> m.getParent().isEmpty())
                        .map(JsonModelWriter::toView)
                        .collect(Collectors.toList()),
                table.getSymbols().stream()
                        .filter(s -> s.getMenu().isEmpty())
                        .map(Symbol::getName)
                        .collect(Collectors.toList()),
                table.getSymbols().stream()
                        .map(JsonModelWriter::toView)
                        .collect(Collectors.toList()));
        gson.toJson(view, out);
        out.write("\n");
        out.flush();
    }

    private static MenuView toView(Menu menu) {
        return new MenuView(
                menu.getPrompt(),
                menu.getOrigin().toString(),
                menu.getSymbols().stream().map(Symbol::getName).collect(Collectors.toList()),
                menu.getChildren().stream().map(JsonModelWriter::toView).collect(Collectors.toList()));
    }

    private static SymbolView toView(Symbol symbol) {
        return new SymbolView(
                symbol.getName(),
                symbol.getKind().map(SymbolKind::keyword).orElse(null),
                symbol.getPrompt().orElse(null),
                names(symbol.getDependencies()),
                names(symbol.getSelects()),
                names(symbol.getDependents()),
                symbol.isDefault(),
                symbol.isSelectable(),
                symbol.isSelected(),
                symbol.getOrigin().toString());
    }

    private static List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(Symbol::getName).collect(Collectors.toList());
    }

    record ModelView(String mainMenu, List<MenuView> menus, List<String> topLevelSymbols, List<SymbolView> symbols) {}

    record MenuView(String prompt, String origin, List<String> symbols, List<MenuView> menus) {}

    record SymbolView(String name, String kind, String prompt, List<String> dependsOn, List<String> selects,
                      List<String> dependents, boolean isDefault, boolean selectable, boolean selected,
                      String origin) {}
}
