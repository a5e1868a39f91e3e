package org.minikconfig.model;

import org.minikconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A named grouping of symbols and nested menus, declared with
 * <code>menu "title"</code> ... <code>endmenu</code>.
 * Menus organize the display only; they do not affect selection.
 */
public class Menu {

    private final String prompt;
    private final Menu parent;
    private final SourceInfo origin;
    private final List<Symbol> symbols = new ArrayList<>();
    private final List<Menu> children = new ArrayList<>();

    Menu(String prompt, Menu parent, SourceInfo origin) {
        this.prompt = prompt;
        this.parent = parent;
        this.origin = origin;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public String getPrompt() { return prompt; }

    public Optional<Menu> getParent() { return Optional.ofNullable(parent); }

    public SourceInfo getOrigin() { return origin; }

    /**
     * Returns the symbols declared directly inside this menu, in declaration order.
     * @return The menu's own symbols.
     */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * Returns the menus nested directly inside this one, in declaration order.
     * @return The child menus.
     */
    public List<Menu> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addSymbol(Symbol symbol) {
        symbols.add(symbol);
    }

    /**
     * Returns the nesting depth, 0 for a top-level menu.
     * @return The number of enclosing menus.
     */
    public int depth() {
        int depth = 0;
        for (Menu m = parent; m != null; m = m.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "menu \"" + prompt + "\"";
    }
}
