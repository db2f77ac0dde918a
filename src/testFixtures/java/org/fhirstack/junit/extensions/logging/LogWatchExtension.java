package org.fhirstack.junit.extensions.logging;

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
import java.util.stream.Stream;

/**
 * Fails a test when it logs at WARN or above without declaring it.
 * <p>
 * Events are captured by a Logback turbo filter, so logs from background threads (health
 * probes, exit watchers, the supervisor's event thread) are seen too. Rules come from
 * {@link AllowLog}, {@link ExpectLog} and {@link FailOnLog} on the test class and method;
 * method rules add to the class rules.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        filter(context).ifPresent(filter -> filter.begin(Rules.of(context)));
    }

    @Override
    public void afterEach(ExtensionContext context) {
        Optional<CapturingFilter> filter = filter(context);
        if (filter.isEmpty()) {
            return;
        }
        Rules rules = filter.get().rules;
        List<Event> events = filter.get().drain();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            events.stream()
                .filter(event -> event.level.isGreaterOrEqual(rules.threshold))
                .filter(event -> !rules.permits(event))
                .forEach(event -> problems.add("unexpected " + event));
        }
        for (Matcher expected : rules.expected) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add("missing " + expected + ": expected " + expected.occurrences + ", found " + count);
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError("Log check failed:\n  " + String.join("\n  ", problems));
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

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Matcher(Level level, Pattern logger, Pattern message, int occurrences) {

        static Matcher of(AllowLog allow) {
            return new Matcher(allow.level().toLogback(), Pattern.compile(allow.loggerPattern()),
                Pattern.compile(allow.messagePattern()), 0);
        }

        static Matcher of(ExpectLog expect) {
            return new Matcher(expect.level().toLogback(), Pattern.compile(expect.loggerPattern()),
                Pattern.compile(expect.messagePattern()), expect.occurrences());
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                && logger.matcher(event.logger).matches()
                && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + logger + "\" message=\"" + message + "\"";
        }
    }

    private static final class Rules {
        final Level threshold;
        final boolean disabled;
        final List<Matcher> allowed;
        final List<Matcher> expected;

        private Rules(Level threshold, boolean disabled, List<Matcher> allowed, List<Matcher> expected) {
            this.threshold = threshold;
            this.disabled = disabled;
            this.allowed = allowed;
            this.expected = expected;
        }

        static Rules of(ExtensionContext context) {
            List<AnnotatedElement> sources = new ArrayList<>();
            context.getTestClass().ifPresent(sources::add);
            context.getTestMethod().ifPresent(sources::add);

            FailOnLog failOnLog = null;
            List<Matcher> allowed = new ArrayList<>();
            List<Matcher> expected = new ArrayList<>();
            for (AnnotatedElement source : sources) {
                if (source.getAnnotation(FailOnLog.class) != null) {
                    failOnLog = source.getAnnotation(FailOnLog.class);
                }
                Stream.of(source.getAnnotationsByType(AllowLog.class)).map(Matcher::of).forEach(allowed::add);
                Stream.of(source.getAnnotationsByType(ExpectLog.class)).map(Matcher::of).forEach(expected::add);
            }
            Level threshold = failOnLog == null ? Level.WARN : failOnLog.level().toLogback();
            return new Rules(threshold, failOnLog != null && failOnLog.disabled(), allowed, expected);
        }

        boolean permits(Event event) {
            return Stream.concat(allowed.stream(), expected.stream()).anyMatch(matcher -> matcher.matches(event));
        }

        Level captureLevel() {
            Level lowest = threshold;
            for (Matcher matcher : expected) {
                if (!matcher.level.isGreaterOrEqual(lowest)) {
                    lowest = matcher.level;
                }
            }
            return lowest;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        void begin(Rules testRules) {
            events.clear();
            this.rules = testRules;
        }

        List<Event> drain() {
            List<Event> captured = new ArrayList<>(events);
            events.clear();
            return captured;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Called once per logging call before the level check; format is null for isXxxEnabled() probes.
            if (format == null || !level.isGreaterOrEqual(rules.captureLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
