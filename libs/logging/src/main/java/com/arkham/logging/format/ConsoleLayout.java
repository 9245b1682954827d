package com.arkham.logging.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import org.slf4j.event.KeyValuePair;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Human-readable console line: {@code timestamp LEVEL [logger] message (key=value ...)}.
 * <p>
 * When colours are enabled only the level is wrapped in ANSI codes; the rest of the line is
 * plain text.
 */
public class ConsoleLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private boolean colored;

    public ConsoleLayout() {
        this(false);
    }

    public ConsoleLayout(boolean colored) {
        this.colored = colored;
    }

    public boolean isColored() {
        return colored;
    }

    public void setColored(boolean colored) {
        this.colored = colored;
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder line = new StringBuilder(128)
                .append(TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp())))
                .append(' ');

        String level = String.format("%-5s", event.getLevel());
        if (colored) {
            line.append(AnsiCodes.colorFor(event.getLevel())).append(level).append(AnsiCodes.RESET);
        } else {
            line.append(level);
        }

        line.append(" [").append(event.getLoggerName()).append("] ")
                .append(event.getFormattedMessage());

        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null && !pairs.isEmpty()) {
            line.append(" (");
            for (int i = 0; i < pairs.size(); i++) {
                if (i > 0) {
                    line.append(' ');
                }
                line.append(pairs.get(i).key).append('=').append(pairs.get(i).value);
            }
            line.append(')');
        }
        line.append(CoreConstants.LINE_SEPARATOR);

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.append(ThrowableProxyUtil.asString(throwable)).append(CoreConstants.LINE_SEPARATOR);
        }
        return line.toString();
    }
}
