package org.minikconfig.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above (or the level set with {@link FailOnLog})
 * unless the event is covered by {@link AllowLog} or {@link ExpectLog}, and when an
 * {@link ExpectLog} is not met. Events are captured with a Logback turbo filter that lives
 * for the whole test class. Allowed and expected events are not printed.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        filter(context).ifPresent(filter -> filter.rules = Rules.resolve(context));
    }

    @Override
    public void afterEach(ExtensionContext context) {
        Optional<CapturingFilter> maybeFilter = filter(context);
        if (maybeFilter.isEmpty()) {
            return;
        }
        CapturingFilter filter = maybeFilter.get();
        Rules rules = filter.rules;
        List<Captured> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Captured event : events) {
                if (!rules.permits(event)) {
                    unexpected.add(String.format("[%s] %s - %s", event.level(), event.loggerName(), event.message()));
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (Rule expected : rules.expected) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(),
                        expected.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static Optional<CapturingFilter> filter(ExtensionContext context) {
        return Optional.ofNullable(context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class));
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Captured(String loggerName, Level level, String message) {}

    private record Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
        boolean matches(Captured event) {
            return event.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, event.loggerName())
                    && Pattern.matches(messagePattern, event.message());
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allowed;
        final List<Rule> expected;

        private Rules(Level minLevel, boolean disabled, List<Rule> allowed, List<Rule> expected) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allowed = allowed;
            this.expected = expected;
        }

        /** Method annotations win over class annotations for {@link FailOnLog}; allow and expect rules add up. */
        static Rules resolve(ExtensionContext context) {
            FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                    .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            List<Rule> allowed = new ArrayList<>();
            List<Rule> expected = new ArrayList<>();
            for (AnnotatedElement element : elements(context)) {
                for (AllowLog allow : element.getAnnotationsByType(AllowLog.class)) {
                    allowed.add(new Rule(allow.level(), allow.loggerPattern(), allow.messagePattern(), 0));
                }
                for (ExpectLog expect : element.getAnnotationsByType(ExpectLog.class)) {
                    expected.add(new Rule(expect.level(), expect.loggerPattern(), expect.messagePattern(),
                            expect.occurrences()));
                }
            }
            return new Rules(
                    toLogback(fail != null ? fail.level() : LogLevel.WARN),
                    fail != null && fail.disabled(),
                    allowed,
                    expected);
        }

        private static List<AnnotatedElement> elements(ExtensionContext context) {
            List<AnnotatedElement> elements = new ArrayList<>();
            context.getTestClass().ifPresent(elements::add);
            context.getTestMethod().ifPresent(elements::add);
            return elements;
        }

        boolean permits(Captured event) {
            return allowed.stream().anyMatch(rule -> rule.matches(event))
                    || expected.stream().anyMatch(rule -> rule.matches(event));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final List<Captured> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Expected events are captured at any level; everything else from the failing level up.
            Rules current = rules;
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            Captured event = new Captured(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            boolean expected = current.expected.stream().anyMatch(rule -> rule.matches(event));
            if (!expected && !level.isGreaterOrEqual(current.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
