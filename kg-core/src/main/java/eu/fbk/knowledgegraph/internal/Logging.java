package eu.fbk.knowledgegraph.internal;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

public final class Logging {

    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);

    /** MDC key holding the graph generation or operation being served. */
    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    @Nullable
    public static Map<String, String> getMDC() {
        try {
            return MDC.getCopyOfContextMap();
        } catch (final Throwable ex) {
            LOGGER.warn("Could not retrieve MDC map", ex);
            return null;
        }
    }

    public static void setMDC(@Nullable final Map<String, String> mdc) {
        try {
            MDC.setContextMap(mdc == null ? Maps.<String, String>newHashMap() : mdc);
        } catch (final Throwable ex) {
            LOGGER.warn("Could not update MDC map", ex);
        }
    }

    public static final class NormalConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            final Level level = event.getLevel();
            switch (level.toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.DEFAULT_FG;
            }
        }

    }

    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final String context = MDC.get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? event
                    .getLoggerName() : null;
            if (context == null) {
                return logger == null ? "" : "[" + logger + "] ";
            } else {
                return logger == null ? "[" + context + "] " : "[" + context + "][" + logger
                        + "] ";
            }
        }

    }

}
