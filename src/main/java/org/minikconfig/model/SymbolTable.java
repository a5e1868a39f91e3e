package org.minikconfig.model;

import org.minikconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The graph of one configuration run: every declared symbol, every menu and the
 * main-menu title.
 * <p>
 * Symbols are stored in an arena in declaration order; the index of a symbol is its
 * position in that arena. Iteration is always in declaration order, which keeps output
 * and default selection deterministic. The table is shared by all files of a run, so
 * symbols from <code>source</code>d files accumulate into the same table.
 * <p>
 * This class is not thread-safe.
 */
public class SymbolTable {

    private final List<Symbol> symbols = new ArrayList<>();
    private final Map<String, Symbol> byName = new HashMap<>();
    private final List<Menu> menus = new ArrayList<>();
    private String mainMenuTitle = "";

    /**
     * Creates a new symbol and registers it, appending it to the declaration order.
     * If the enclosing menu is given, the symbol is also added to that menu.
     *
     * @param name The unique symbol name.
     * @param origin Where the <code>config</code> statement was written.
     * @param menu The enclosing menu, or null.
     * @return The new symbol.
     * @throws IllegalArgumentException if a symbol with that name already exists.
     */
    public Symbol define(String name, SourceInfo origin, Menu menu) {
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("Symbol '" + name + "' is already defined.");
        }
        Symbol symbol = new Symbol(name, symbols.size(), origin, menu);
        symbols.add(symbol);
        byName.put(name, symbol);
        if (menu != null) {
            menu.addSymbol(symbol);
        }
        return symbol;
    }

    /**
     * Creates a new menu and registers it.
     *
     * @param prompt The menu title.
     * @param parent The enclosing menu, or null for a top-level menu.
     * @param origin Where the <code>menu</code> statement was written.
     * @return The new menu.
     */
    public Menu defineMenu(String prompt, Menu parent, SourceInfo origin) {
        Menu menu = new Menu(prompt, parent, origin);
        menus.add(menu);
        return menu;
    }

    public Optional<Symbol> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Returns all symbols in declaration order.
     * @return An unmodifiable view of the symbols.
     */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * Returns all selected symbols in declaration order.
     * @return The selected symbols.
     */
    public List<Symbol> getSelectedSymbols() {
        List<Symbol> selected = new ArrayList<>();
        for (Symbol symbol : symbols) {
            if (symbol.isSelected()) {
                selected.add(symbol);
            }
        }
        return selected;
    }

    /**
     * Returns all menus in declaration order, nested ones included.
     * @return An unmodifiable view of the menus.
     */
    public List<Menu> getMenus() {
        return Collections.unmodifiableList(menus);
    }

    public int size() {
        return symbols.size();
    }

    public String getMainMenuTitle() { return mainMenuTitle; }

    public void setMainMenuTitle(String mainMenuTitle) {
        this.mainMenuTitle = mainMenuTitle;
    }
}
