package io.github.hongjungwan.jsonlog.core.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.POJONode;
import io.github.hongjungwan.jsonlog.api.domain.ExceptionInfo;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 임의의 extra 값을 JSON 트리로 변환. 실패는 해당 값만 문자열로 대체하고 예외를 던지지 않는다.
 *
 * 네이티브 표현: null, boolean, 정수, BigDecimal/BigInteger, 유한 실수, 문자열, enum, Map,
 * Iterable, 배열, Optional, Throwable, JsonNode(하위 노드까지 같은 규칙 적용). 그 외(NaN/Infinity 포함)는 toString().
 *
 * 사용자 코드가 던진 Error와 (sneaky throw 된) checked 예외도 흡수한다. VirtualMachineError는 StackOverflowError만 흡수.
 */
public class SafeValueConverter {

    static final String CIRCULAR_MARKER = "[circular reference]";
    static final String MAX_DEPTH_MARKER = "[max depth exceeded]";

    private final JsonNodeFactory nodes = JsonNodeFactory.withExactBigDecimals(true);
    private final int maxDepth;

    public SafeValueConverter(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /** 값 하나를 JSON 노드로 변환 */
    public JsonNode convert(Object value) {
        return convert(value, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /** 예외 서브 객체: type, message, stackTrace */
    public ObjectNode convertException(ExceptionInfo info) {
        ObjectNode node = nodes.objectNode();
        node.put("type", info.getType());
        node.put("message", info.getMessage());
        node.put("stackTrace", info.getStackTrace());
        return node;
    }

    private JsonNode convert(Object value, int depth, Set<Object> path) {
        try {
            return doConvert(value, depth, path);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            return nodes.textNode(unrenderable(value, e));
        }
    }

    private JsonNode doConvert(Object value, int depth, Set<Object> path) {
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof JsonNode) {
            return convertNode((JsonNode) value, depth, path);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return nodes.textNode(value.toString());
        }
        if (value instanceof Boolean) {
            return nodes.booleanNode((Boolean) value);
        }
        if (value instanceof Number) {
            return convertNumber((Number) value);
        }
        if (value instanceof Enum) {
            return nodes.textNode(((Enum<?>) value).name());
        }
        if (value instanceof Optional) {
            return convert(((Optional<?>) value).orElse(null), depth, path);
        }
        if (value instanceof ExceptionInfo) {
            return convertException((ExceptionInfo) value);
        }
        if (value instanceof Throwable) {
            return convertException(ExceptionInfo.from((Throwable) value));
        }
        if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
            return convertContainer(value, depth, path);
        }
        return nodes.textNode(safeToString(value));
    }

    private JsonNode convertNumber(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return nodes.numberNode(number.intValue());
        }
        if (number instanceof Long) {
            return nodes.numberNode(number.longValue());
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            // JSON에는 NaN/Infinity 리터럴이 없음
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return nodes.textNode(number.toString());
            }
            return number instanceof Float ? nodes.numberNode(number.floatValue()) : nodes.numberNode(d);
        }
        if (number instanceof BigDecimal) {
            return nodes.numberNode((BigDecimal) number);
        }
        if (number instanceof BigInteger) {
            return nodes.numberNode((BigInteger) number);
        }
        return nodes.textNode(safeToString(number));
    }

    /** 호출자가 넘긴 JSON 트리. POJONode는 감싼 값으로 풀고 컨테이너는 하위 노드까지 변환 */
    private JsonNode convertNode(JsonNode node, int depth, Set<Object> path) {
        if (node instanceof POJONode) {
            return convert(((POJONode) node).getPojo(), depth, path);
        }
        if (node.isContainerNode()) {
            return convertContainer(node, depth, path);
        }
        if (node.isMissingNode()) {
            return nodes.nullNode();
        }
        if (node.isNumber()) {
            return convertNumber(node.numberValue());
        }
        return node;
    }

    private JsonNode convertContainer(Object container, int depth, Set<Object> path) {
        if (depth >= maxDepth) {
            return nodes.textNode(MAX_DEPTH_MARKER);
        }
        if (!path.add(container)) {
            return nodes.textNode(CIRCULAR_MARKER);
        }
        try {
            if (container instanceof ObjectNode) {
                ObjectNode node = nodes.objectNode();
                Iterator<Map.Entry<String, JsonNode>> fields = ((ObjectNode) container).fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    node.set(field.getKey(), convert(field.getValue(), depth + 1, path));
                }
                return node;
            }
            if (container instanceof Map) {
                ObjectNode node = nodes.objectNode();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) container).entrySet()) {
                    node.set(String.valueOf(entry.getKey()), convert(entry.getValue(), depth + 1, path));
                }
                return node;
            }
            ArrayNode array = nodes.arrayNode();
            if (container instanceof Iterable) {
                for (Object element : (Iterable<?>) container) {
                    array.add(convert(element, depth + 1, path));
                }
            } else {
                int length = Array.getLength(container);
                for (int i = 0; i < length; i++) {
                    array.add(convert(Array.get(container, i), depth + 1, path));
                }
            }
            return array;
        } catch (Throwable e) {
            rethrowIfFatal(e);
            // 순회 중 실패한 컨테이너는 toString도 믿을 수 없음
            return nodes.textNode(unrenderable(container, e));
        } finally {
            path.remove(container);
        }
    }

    /** toString() 호출. 사용자 객체 그래프를 따라 무한 재귀할 수 있으므로 StackOverflowError도 흡수 */
    static String safeToString(Object value) {
        try {
            return String.valueOf(value);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            return unrenderable(value, e);
        }
    }

    /** OutOfMemoryError 등 JVM 상태 이상은 전파. StackOverflowError는 스택이 풀린 뒤라 복구 가능 */
    static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
            throw (VirtualMachineError) e;
        }
    }

    static String unrenderable(Object value, Throwable cause) {
        return "[unrenderable " + value.getClass().getName() + ": " + cause.getClass().getSimpleName() + "]";
    }
}
