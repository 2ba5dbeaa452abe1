package org.shellgo.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by
 * {@link AllowLog} or {@link ExpectLog}, and fails a test whose expected
 * events did not occur. Covered events are kept out of the console output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class.getName());
    private static final Level MIN_LEVEL = Level.WARN;

    @Override
    public void beforeAll(ExtensionContext context) {
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        lc.addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<String> unexpected = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (!rules.covers(event)) {
                unexpected.add(event.toString());
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog expect : rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(),
                    expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        filter.events.clear();

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
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
            lc.getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        context.getTestMethod().ifPresent(m -> {
            allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class)));
        });
        return new Rules(allows, expects);
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.message).matches();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(List<AllowLog> allows, List<ExpectLog> expects) {
        boolean covers(CapturedEvent event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(MIN_LEVEL)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
