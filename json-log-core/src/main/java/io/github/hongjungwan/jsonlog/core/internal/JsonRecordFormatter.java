package io.github.hongjungwan.jsonlog.core.internal;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.jsonlog.api.RecordFormatter;
import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import io.github.hongjungwan.jsonlog.api.config.StandardField;
import io.github.hongjungwan.jsonlog.api.domain.LogRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Jackson 기반 JSON 포맷터. 표준 필드 → extra → exception → stack_info 순으로 출력.
 *
 * 예약 필드명과 충돌하는 extra 키는 버린다. 인스턴스 상태는 생성 후 불변.
 */
@Slf4j
public class JsonRecordFormatter implements RecordFormatter {

    public static final String EXCEPTION_KEY = "exception";
    public static final String STACK_INFO_KEY = "stack_info";
    public static final String FORMATTER_ERROR_KEY = "formatter_error";

    /** ISO-8601, UTC, 밀리초, 명시적 +00:00 오프셋 */
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSxxx", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final FormatterConfig config;
    private final List<StandardField> fields;
    private final Set<String> reservedKeys;
    private final String timestampKey;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final JsonNodeFactory nodes;
    private final SafeValueConverter converter;

    public JsonRecordFormatter(FormatterConfig config) {
        Integer indent = config.getJsonIndent();
        if (indent != null && indent < 0) {
            throw new IllegalArgumentException("jsonIndent must be non-negative, got: " + indent);
        }
        String key = config.getTimestampKey();
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("timestampKey must not be blank");
        }

        this.config = config;
        this.timestampKey = key;
        this.fields = resolveFields(config.getFields());
        this.reservedKeys = reservedKeys(key);
        this.converter = new SafeValueConverter(config.getMaxDepth());
        this.mapper = createObjectMapper(config.isEnsureAscii());
        this.nodes = mapper.getNodeFactory();
        this.writer = indent == null
                ? mapper.writer()
                : mapper.writer(new IndentingPrettyPrinter(indent));
    }

    private ObjectMapper createObjectMapper(boolean ensureAscii) {
        JsonFactoryBuilder factory = new JsonFactoryBuilder();
        if (ensureAscii) {
            factory.enable(JsonWriteFeature.ESCAPE_NON_ASCII);
        }
        return new ObjectMapper(factory.build());
    }

    /** 모르는 필드명은 버리고 경고 한 번, 중복은 첫 위치만 유지 */
    private static List<StandardField> resolveFields(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of(StandardField.values());
        }

        Set<StandardField> resolved = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            StandardField.fromName(name).ifPresentOrElse(resolved::add, () -> unknown.add(name));
        }

        if (!unknown.isEmpty()) {
            log.warn("Ignoring unknown log fields {}; supported fields are {}",
                    unknown, Arrays.toString(StandardField.values()).toLowerCase(Locale.ROOT));
        }
        return List.copyOf(resolved);
    }

    private static Set<String> reservedKeys(String timestampKey) {
        Set<String> keys = new HashSet<>();
        for (StandardField field : StandardField.values()) {
            keys.add(field.fieldName());
        }
        keys.add(timestampKey);
        return Set.copyOf(keys);
    }

    @Override
    public String format(LogRecord record) {
        if (record == null) {
            return fallback(null, new IllegalArgumentException("record is null"));
        }
        try {
            return writer.writeValueAsString(render(record));
        } catch (Throwable e) {
            SafeValueConverter.rethrowIfFatal(e);
            return fallback(record, e);
        }
    }

    @Override
    public FormatterConfig getConfig() {
        return config;
    }

    /** 출력 객체 구성 (키 순서 = 출력 순서) */
    ObjectNode render(LogRecord record) {
        ObjectNode root = mapper.createObjectNode();

        for (StandardField field : fields) {
            root.set(keyOf(field), standardValue(field, record));
        }

        for (Map.Entry<String, Object> entry : record.getExtra().entrySet()) {
            String key = entry.getKey();
            if (key == null || reservedKeys.contains(key)) {
                continue;
            }
            root.set(key, converter.convert(entry.getValue()));
        }

        if (record.getExceptionInfo() != null) {
            appendLast(root, EXCEPTION_KEY, converter.convertException(record.getExceptionInfo()));
        }

        String stackInfo = record.getStackInfo();
        if (stackInfo != null && !stackInfo.isBlank()) {
            appendLast(root, STACK_INFO_KEY, nodes.textNode(stackInfo));
        }

        return root;
    }

    private String keyOf(StandardField field) {
        return field == StandardField.TIMESTAMP ? timestampKey : field.fieldName();
    }

    private JsonNode standardValue(StandardField field, LogRecord record) {
        return switch (field) {
            case TIMESTAMP -> record.getTimestamp() == null
                    ? nodes.nullNode()
                    : nodes.textNode(formatTimestamp(record.getTimestamp()));
            case LEVEL -> nodes.textNode(upperCase(record.getLevel()));
            case LOGGER -> nodes.textNode(record.getLoggerName());
            case MESSAGE -> nodes.textNode(record.getMessage());
            case MODULE -> nodes.textNode(orEmpty(record.getModule()));
            case FUNCTION -> nodes.textNode(orEmpty(record.getFunction()));
            case LINE -> nodes.numberNode(Math.max(0, record.getLine()));
        };
    }

    /** 같은 키의 extra 값을 대체하면서 맨 뒤에 배치 */
    private static void appendLast(ObjectNode root, String key, JsonNode value) {
        root.remove(key);
        root.set(key, value);
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    private static String upperCase(String level) {
        return level == null ? null : level.toUpperCase(Locale.ROOT);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    /** 레코드 전체 렌더링 실패 시 최소 필드만 담은 객체 */
    private String fallback(LogRecord record, Throwable cause) {
        ObjectNode node = mapper.createObjectNode();
        if (record != null) {
            node.put(timestampKey, record.getTimestamp() == null ? null : formatTimestamp(record.getTimestamp()));
            node.put(StandardField.LEVEL.fieldName(), upperCase(record.getLevel()));
            node.put(StandardField.LOGGER.fieldName(), record.getLoggerName());
            node.put(StandardField.MESSAGE.fieldName(), record.getMessage());
        }
        node.put(FORMATTER_ERROR_KEY, SafeValueConverter.safeToString(cause));
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return "{\"" + FORMATTER_ERROR_KEY + "\":\"unrenderable record\"}";
        }
    }
}
