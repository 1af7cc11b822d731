package org.calcmark.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fails a test that logs anything at WARN or above. Events are captured with a Logback
 * turbo filter, so they are seen even when the logger's own level would drop them.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getTurboFilterList().remove(filter);
        filter.stop();

        if (!filter.events.isEmpty()) {
            StringBuilder sb = new StringBuilder("Unexpected logs:\n");
            filter.events.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            throw new AssertionError(sb.toString());
        }
    }

    private static class CapturingFilter extends TurboFilter {
        private final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also calls decide() for isXxxEnabled() checks, with a null format.
            if (format != null && level.isGreaterOrEqual(Level.WARN)) {
                String message = MessageFormatter.arrayFormat(format, params).getMessage();
                events.add(String.format("[%s] %s - %s", level, logger.getName(), message));
            }
            return FilterReply.NEUTRAL;
        }
    }
}
