package io.github.hongjungwan.jsonlog.core.jul;

import io.github.hongjungwan.jsonlog.api.RecordFormatter;
import io.github.hongjungwan.jsonlog.api.RecordFormatterFactory;
import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import io.github.hongjungwan.jsonlog.api.domain.ExceptionInfo;
import io.github.hongjungwan.jsonlog.api.domain.LogRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.logging.Formatter;
import java.util.logging.LogManager;
import java.util.stream.Collectors;

/**
 * java.util.logging 용 JSON Formatter.
 *
 * 기본 생성자는 LogManager 속성에서 설정을 읽는다:
 * <pre>
 * java.util.logging.ConsoleHandler.formatter = io.github.hongjungwan.jsonlog.core.jul.JsonJulFormatter
 * io.github.hongjungwan.jsonlog.core.jul.JsonJulFormatter.fields = timestamp,level,message
 * io.github.hongjungwan.jsonlog.core.jul.JsonJulFormatter.jsonIndent = 2
 * </pre>
 */
@Slf4j
public class JsonJulFormatter extends Formatter {

    private static final String PROPERTY_PREFIX = JsonJulFormatter.class.getName();
    private static final String FORMATTER_ERROR_KEY = "formatter_error";

    private final RecordFormatter formatter;

    public JsonJulFormatter() {
        this(configFromProperties(LogManager.getLogManager()::getProperty));
    }

    public JsonJulFormatter(FormatterConfig config) {
        this.formatter = RecordFormatterFactory.create(config);
    }

    @Override
    public String format(java.util.logging.LogRecord record) {
        LogRecord converted;
        try {
            converted = toRecord(record);
        } catch (Exception e) {
            converted = minimalRecord(record, e);
        }
        return formatter.format(converted) + System.lineSeparator();
    }

    /** 변환 실패 시 시각, 레벨, 로거, 원본 메시지와 실패 원인만 남긴다 */
    private static LogRecord minimalRecord(java.util.logging.LogRecord record, Exception cause) {
        return LogRecord.builder()
                .timestamp(record.getInstant())
                .level(record.getLevel() == null ? null : record.getLevel().getName())
                .loggerName(record.getLoggerName())
                .message(record.getMessage())
                .extra(Map.of(FORMATTER_ERROR_KEY, cause))
                .build();
    }

    LogRecord toRecord(java.util.logging.LogRecord record) {
        return LogRecord.builder()
                .timestamp(record.getInstant())
                .level(record.getLevel() == null ? null : record.getLevel().getName())
                .loggerName(record.getLoggerName())
                .message(formatMessage(record))
                .module(record.getSourceClassName())
                .function(record.getSourceMethodName())
                .extra(extractExtra(record.getParameters()))
                .exceptionInfo(record.getThrown() == null ? null : ExceptionInfo.from(record.getThrown()))
                .build();
    }

    /** 마지막 파라미터가 Map이면 extra로 사용 */
    private static Map<String, Object> extractExtra(Object[] parameters) {
        if (parameters == null || parameters.length == 0 || !(parameters[parameters.length - 1] instanceof Map)) {
            return Map.of();
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) parameters[parameters.length - 1]).entrySet()) {
            if (entry.getKey() != null) {
                extra.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return extra;
    }

    static FormatterConfig configFromProperties(UnaryOperator<String> properties) {
        FormatterConfig.FormatterConfigBuilder builder = FormatterConfig.builder();

        String fields = properties.apply(PROPERTY_PREFIX + ".fields");
        if (fields != null && !fields.isBlank()) {
            builder.fields(splitFields(fields));
        }

        String indent = properties.apply(PROPERTY_PREFIX + ".jsonIndent");
        if (indent != null && !indent.isBlank()) {
            try {
                builder.jsonIndent(Integer.parseInt(indent.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid {}.jsonIndent value '{}'", PROPERTY_PREFIX, indent);
            }
        }

        String timestampKey = properties.apply(PROPERTY_PREFIX + ".timestampKey");
        if (timestampKey != null && !timestampKey.isBlank()) {
            builder.timestampKey(timestampKey.trim());
        }

        String ensureAscii = properties.apply(PROPERTY_PREFIX + ".ensureAscii");
        if (ensureAscii != null) {
            builder.ensureAscii(Boolean.parseBoolean(ensureAscii.trim()));
        }

        return builder.build();
    }

    private static List<String> splitFields(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
    }
}
