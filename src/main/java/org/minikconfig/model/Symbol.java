package org.minikconfig.model;

import org.minikconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A named configuration unit declared with <code>config NAME</code>.
 * <p>
 * A symbol is built in two phases. While parsing, its dependencies and selects are
 * collected as textual {@link SymbolReference}s. The
 * {@link org.minikconfig.frontend.semantics.ReferenceResolver} later turns them into
 * direct links and fills the {@link #getDependents() dependents} back-edges.
 * The selection flags are mutated afterwards by the
 * {@link org.minikconfig.selection.SelectionEngine}.
 * <p>
 * Instances are owned by a {@link SymbolTable} and are not thread-safe.
 */
public class Symbol {

    private final String name;
    private final int index;
    private final SourceInfo origin;
    private final Menu menu;

    private SymbolKind kind;
    private String prompt;

    private final List<SymbolReference> dependencyReferences = new ArrayList<>();
    private final List<SymbolReference> selectReferences = new ArrayList<>();

    private final List<Symbol> dependencies = new ArrayList<>();
    private final List<Symbol> selects = new ArrayList<>();
    private final List<Symbol> dependents = new ArrayList<>();
    private boolean resolved = false;

    private boolean isDefault = false;
    private boolean selectable = false;
    private boolean selected = false;

    Symbol(String name, int index, SourceInfo origin, Menu menu) {
        this.name = name;
        this.index = index;
        this.origin = origin;
        this.menu = menu;
    }

    public String getName() { return name; }

    /**
     * Returns the position of this symbol in its table, which is also its declaration order.
     * @return The zero-based table index.
     */
    public int getIndex() { return index; }

    public SourceInfo getOrigin() { return origin; }

    /**
     * Returns the menu that declared this symbol.
     * @return The enclosing menu, or empty for top-level symbols.
     */
    public Optional<Menu> getMenu() { return Optional.ofNullable(menu); }

    public Optional<SymbolKind> getKind() { return Optional.ofNullable(kind); }

    public Optional<String> getPrompt() { return Optional.ofNullable(prompt); }

    /**
     * Sets the kind of this symbol. A non-null prompt given with the kind replaces the current prompt.
     * @param kind The declared kind.
     * @param kindPrompt The prompt written after the kind keyword, or null.
     */
    public void setKind(SymbolKind kind, String kindPrompt) {
        this.kind = kind;
        if (kindPrompt != null) {
            this.prompt = kindPrompt;
        }
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public void addDependency(SymbolReference reference) {
        dependencyReferences.add(reference);
    }

    public void addSelect(SymbolReference reference) {
        selectReferences.add(reference);
    }

    /**
     * Returns the dependency names as written, before resolution.
     * @return The textual dependency references.
     */
    public List<SymbolReference> getDependencyReferences() {
        return Collections.unmodifiableList(dependencyReferences);
    }

    /**
     * Returns the select names as written, before resolution.
     * @return The textual select references.
     */
    public List<SymbolReference> getSelectReferences() {
        return Collections.unmodifiableList(selectReferences);
    }

    /**
     * Returns the resolved dependencies. Empty until the resolver has run.
     * @return The symbols that must all be selected before this one can be.
     */
    public List<Symbol> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Returns the resolved selects. Empty until the resolver has run.
     * @return The symbols this one forces into selection.
     */
    public List<Symbol> getSelects() {
        return Collections.unmodifiableList(selects);
    }

    /**
     * Returns the symbols that depend on this one.
     * @return The dependency back-edges.
     */
    public List<Symbol> getDependents() {
        return Collections.unmodifiableList(dependents);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Checks whether every dependency is currently selected.
     * @return true if the symbol has no dependencies or all of them are selected.
     */
    public boolean areDependenciesMet() {
        for (Symbol dependency : dependencies) {
            if (!dependency.isSelected()) {
                return false;
            }
        }
        return true;
    }

    public void linkDependency(Symbol target) {
        dependencies.add(target);
    }

    public void linkSelect(Symbol target) {
        selects.add(target);
    }

    public void addDependent(Symbol dependent) {
        dependents.add(dependent);
    }

    public boolean isResolved() { return resolved; }

    public void markResolved() {
        this.resolved = true;
    }

    public boolean isDefault() { return isDefault; }

    /**
     * Records the value of a <code>default</code> line.
     * @param isDefault true for <code>default y</code>, false for <code>default n</code>.
     */
    public void makeDefault(boolean isDefault) {
        this.isDefault = isDefault;
    }

    public boolean isSelectable() { return selectable; }

    public void makeSelectable() {
        this.selectable = true;
    }

    public boolean isSelected() { return selected; }

    public void setSelected(boolean selected) {
        this.selected = selected;
    }

    @Override
    public String toString() {
        return prompt != null ? name + ": '" + prompt + "'" : name;
    }
}
