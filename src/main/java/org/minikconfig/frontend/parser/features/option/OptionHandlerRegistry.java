package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.model.SymbolKind;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for the option-line handlers of a <code>config</code> block.
 */
public class OptionHandlerRegistry {
    private final Map<String, IOptionHandler> handlers = new HashMap<>();

    /**
     * Registers a new option handler.
     * @param keyword The keyword that starts the option line (e.g., "select").
     * @param handler The handler for the option.
     */
    public void register(String keyword, IOptionHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IOptionHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in option handlers.
     * @return A new instance of {@link OptionHandlerRegistry} with all handlers registered.
     */
    public static OptionHandlerRegistry initialize() {
        OptionHandlerRegistry registry = new OptionHandlerRegistry();
        for (SymbolKind kind : SymbolKind.values()) {
            registry.register(kind.keyword(), new TypeOptionHandler(kind));
        }
        registry.register("prompt", new PromptOptionHandler());
        registry.register("default", new DefaultOptionHandler());
        registry.register("depends", new DependsOptionHandler());
        registry.register("select", new SelectOptionHandler());

        HelpOptionHandler help = new HelpOptionHandler();
        registry.register("help", help);
        registry.register("--help--", help);
        return registry;
    }
}
