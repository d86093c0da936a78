package io.github.hongjungwan.jsonlog.core.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import io.github.hongjungwan.jsonlog.api.domain.ExceptionInfo;
import io.github.hongjungwan.jsonlog.api.domain.LogRecord;
import org.slf4j.event.KeyValuePair;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logback ILoggingEvent → LogRecord 변환.
 *
 * extra 병합 순서: MDC → SLF4J key/value → 마지막 인자가 Map이면 그 내용 (뒤에 온 값이 우선).
 */
public class LoggingEventRecordAdapter {

    private final boolean includeMdc;

    public LoggingEventRecordAdapter(boolean includeMdc) {
        this.includeMdc = includeMdc;
    }

    public LogRecord toRecord(ILoggingEvent event) {
        LogRecord.LogRecordBuilder builder = LogRecord.builder()
                .timestamp(extractTimestamp(event))
                .level(event.getLevel() == null ? null : event.getLevel().toString())
                .loggerName(event.getLoggerName())
                .message(event.getFormattedMessage())
                .extra(extractExtra(event))
                .exceptionInfo(extractExceptionInfo(event.getThrowableProxy()));

        StackTraceElement[] callerData = event.getCallerData();
        if (callerData != null && callerData.length > 0) {
            StackTraceElement caller = callerData[0];
            builder.module(caller.getClassName())
                    .function(caller.getMethodName())
                    .line(caller.getLineNumber());
        }
        return builder.build();
    }

    private static Instant extractTimestamp(ILoggingEvent event) {
        Instant instant = event.getInstant();
        return instant != null ? instant : Instant.ofEpochMilli(event.getTimeStamp());
    }

    private Map<String, Object> extractExtra(ILoggingEvent event) {
        Map<String, Object> extra = new LinkedHashMap<>();

        if (includeMdc) {
            Map<String, String> mdc = event.getMDCPropertyMap();
            if (mdc != null) {
                extra.putAll(mdc);
            }
        }

        List<KeyValuePair> keyValuePairs = event.getKeyValuePairs();
        if (keyValuePairs != null) {
            for (KeyValuePair pair : keyValuePairs) {
                if (pair.key != null) {
                    extra.put(pair.key, pair.value);
                }
            }
        }

        Object[] args = event.getArgumentArray();
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) args[args.length - 1]).entrySet()) {
                if (entry.getKey() != null) {
                    extra.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        }
        return extra;
    }

    static ExceptionInfo extractExceptionInfo(IThrowableProxy proxy) {
        if (proxy == null) {
            return null;
        }
        return ExceptionInfo.builder()
                .type(proxy.getClassName())
                .message(proxy.getMessage())
                .stackTrace(ThrowableProxyUtil.asString(proxy).stripTrailing())
                .build();
    }
}
