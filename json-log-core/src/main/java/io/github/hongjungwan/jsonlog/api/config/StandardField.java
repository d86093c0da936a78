package io.github.hongjungwan.jsonlog.api.config;

import java.util.Optional;

/**
 * 표준 출력 필드. 선언 순서가 기본 출력 순서.
 */
public enum StandardField {

    TIMESTAMP("timestamp"),
    LEVEL("level"),
    LOGGER("logger"),
    MESSAGE("message"),
    MODULE("module"),
    FUNCTION("function"),
    LINE("line");

    private final String fieldName;

    StandardField(String fieldName) {
        this.fieldName = fieldName;
    }

    /** JSON 출력 키 */
    public String fieldName() {
        return fieldName;
    }

    /** 필드명으로 조회 (대소문자 구분, 모르는 이름이면 empty) */
    public static Optional<StandardField> fromName(String name) {
        for (StandardField field : values()) {
            if (field.fieldName.equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
