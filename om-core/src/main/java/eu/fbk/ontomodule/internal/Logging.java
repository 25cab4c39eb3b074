package eu.fbk.ontomodule.internal;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

/**
 * MDC scoping and logback pattern converters shared by the extraction engine and the tools.
 * <p>
 * Work on a module runs inside a {@link Scope} opened with {@link #scope(String)}, which stores
 * the module name under the {@link #MDC_CONTEXT} key; the {@code ctx} conversion word of the
 * bundled logback configurations ({@link ContextConverter}) prints it as a prefix. The
 * {@code nc} and {@code bc} words ({@link NormalConverter}, {@link BoldConverter}) color a
 * message by level.
 * </p>
 */
public final class Logging {

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    /**
     * Sets the context logged with subsequent messages of the current thread.
     *
     * @param context
     *            the context, e.g., the name of the module being extracted
     * @return a scope that restores the previous MDC content when closed
     */
    public static Scope scope(final String context) {
        final Map<String, String> saved = MDC.getCopyOfContextMap();
        MDC.put(MDC_CONTEXT, context);
        return new Scope(saved);
    }

    /**
     * An MDC change undone by {@link #close()}.
     */
    public static final class Scope implements AutoCloseable {

        @Nullable
        private final Map<String, String> saved;

        private Scope(@Nullable final Map<String, String> saved) {
            this.saved = saved == null ? null : ImmutableMap.copyOf(saved);
        }

        @Override
        public void close() {
            if (this.saved == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(this.saved);
            }
        }

    }

    abstract static class LevelColorConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        private final String prefix;

        LevelColorConverter(final String prefix) {
            this.prefix = prefix;
        }

        @Override
        protected final String getForegroundColorCode(final ILoggingEvent event) {
            final int level = event.getLevel().toInt();
            final String color = level >= Level.ERROR_INT ? ANSIConstants.RED_FG
                    : level >= Level.WARN_INT ? ANSIConstants.MAGENTA_FG
                            : ANSIConstants.DEFAULT_FG;
            return this.prefix + color;
        }

    }

    public static final class NormalConverter extends LevelColorConverter {

        public NormalConverter() {
            super("");
        }

    }

    public static final class BoldConverter extends LevelColorConverter {

        public BoldConverter() {
            super(ANSIConstants.BOLD);
        }

    }

    /**
     * Emits {@code [context] } when a context is set; warnings and errors are additionally
     * tagged with the simple name of their logger.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final StringBuilder builder = new StringBuilder();
            final String context = event.getMDCPropertyMap().get(MDC_CONTEXT);
            if (context != null) {
                builder.append('[').append(context).append(']');
            }
            if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
                final String name = event.getLoggerName();
                builder.append('[').append(name.substring(name.lastIndexOf('.') + 1)).append(']');
            }
            return builder.length() == 0 ? "" : builder.append(' ').toString();
        }

    }

}
