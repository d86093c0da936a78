package io.github.hongjungwan.jsonlog.core.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import io.github.hongjungwan.jsonlog.api.RecordFormatter;
import io.github.hongjungwan.jsonlog.api.RecordFormatterFactory;
import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import io.github.hongjungwan.jsonlog.api.domain.LogRecord;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 이벤트 한 건을 JSON 한 줄로 출력하는 Logback Layout.
 *
 * <pre>{@code
 * <appender name="STDOUT" class="ch.qos.logback.core.ConsoleAppender">
 *   <encoder class="ch.qos.logback.core.encoder.LayoutWrappingEncoder">
 *     <layout class="io.github.hongjungwan.jsonlog.core.logback.JsonRecordLayout">
 *       <fields>timestamp,level,logger,message</fields>
 *       <timestampKey>@timestamp</timestampKey>
 *     </layout>
 *   </encoder>
 * </appender>
 * }</pre>
 */
public class JsonRecordLayout extends LayoutBase<ILoggingEvent> {

    private String fields;
    private Integer jsonIndent;
    private String timestampKey = "timestamp";
    private boolean ensureAscii = false;
    private boolean includeMdc = true;

    private RecordFormatter formatter;
    private LoggingEventRecordAdapter adapter;

    @Override
    public void start() {
        try {
            formatter = RecordFormatterFactory.create(buildConfig());
        } catch (IllegalArgumentException e) {
            addError("Invalid JsonRecordLayout configuration: " + e.getMessage(), e);
            return;
        }
        adapter = new LoggingEventRecordAdapter(includeMdc);
        super.start();
    }

    FormatterConfig buildConfig() {
        return FormatterConfig.builder()
                .fields(parseFields(fields))
                .jsonIndent(jsonIndent)
                .timestampKey(timestampKey)
                .ensureAscii(ensureAscii)
                .build();
    }

    private static List<String> parseFields(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        if (!isStarted()) {
            return CoreConstants.EMPTY_STRING;
        }
        LogRecord record;
        try {
            record = adapter.toRecord(event);
        } catch (Exception e) {
            addWarn("Failed to read logging event from " + event.getLoggerName() + ", writing level and logger only", e);
            record = LogRecord.builder()
                    .timestamp(Instant.ofEpochMilli(event.getTimeStamp()))
                    .level(String.valueOf(event.getLevel()))
                    .loggerName(event.getLoggerName())
                    .build();
        }
        return formatter.format(record) + CoreConstants.LINE_SEPARATOR;
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    public String getFields() {
        return fields;
    }

    /** 쉼표로 구분한 표준 필드 목록 */
    public void setFields(String fields) {
        this.fields = fields;
    }

    public Integer getJsonIndent() {
        return jsonIndent;
    }

    public void setJsonIndent(Integer jsonIndent) {
        this.jsonIndent = jsonIndent;
    }

    public String getTimestampKey() {
        return timestampKey;
    }

    public void setTimestampKey(String timestampKey) {
        this.timestampKey = timestampKey;
    }

    public boolean isEnsureAscii() {
        return ensureAscii;
    }

    public void setEnsureAscii(boolean ensureAscii) {
        this.ensureAscii = ensureAscii;
    }

    public boolean isIncludeMdc() {
        return includeMdc;
    }

    public void setIncludeMdc(boolean includeMdc) {
        this.includeMdc = includeMdc;
    }
}
