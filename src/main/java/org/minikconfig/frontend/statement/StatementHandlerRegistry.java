package org.minikconfig.frontend.statement;

import org.minikconfig.frontend.parser.features.config.ConfigStatementHandler;
import org.minikconfig.frontend.parser.features.mainmenu.MainMenuStatementHandler;
import org.minikconfig.frontend.parser.features.menu.EndMenuStatementHandler;
import org.minikconfig.frontend.parser.features.menu.MenuStatementHandler;
import org.minikconfig.frontend.parser.features.source.SourceStatementHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of top-level keywords
 * to their corresponding handlers. Keywords are case-sensitive.
 */
public class StatementHandlerRegistry {
    private final Map<String, IStatementHandler> handlers = new HashMap<>();

    /**
     * Registers a new statement handler.
     * @param keyword The keyword that starts the statement (e.g., "config").
     * @param handler The handler for the statement.
     */
    public void register(String keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register("mainmenu", new MainMenuStatementHandler());
        registry.register("menu", new MenuStatementHandler());
        registry.register("endmenu", new EndMenuStatementHandler());
        registry.register("config", new ConfigStatementHandler());
        registry.register("source", new SourceStatementHandler());
        return registry;
    }
}
