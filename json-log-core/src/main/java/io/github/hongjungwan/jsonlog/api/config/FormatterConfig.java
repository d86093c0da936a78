package io.github.hongjungwan.jsonlog.api.config;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 포맷터 설정. 생성 후 변경 불가.
 */
@Getter
@Builder(toBuilder = true)
public class FormatterConfig {

    /** 출력할 표준 필드와 순서 (비어 있으면 표준 필드 전체) */
    @Builder.Default
    private final List<String> fields = List.of();

    /** Pretty-print 들여쓰기 폭 (null이면 한 줄 출력) */
    private final Integer jsonIndent;

    /** 타임스탬프 출력 키 */
    @Builder.Default
    private final String timestampKey = "timestamp";

    /** 비 ASCII 문자를 유니코드 이스케이프로 출력 */
    @Builder.Default
    private final boolean ensureAscii = false;

    /** extra 값의 최대 중첩 깊이. 초과 시 문자열 마커로 대체 */
    @Builder.Default
    private final int maxDepth = 32;

    /** 기본 설정: 표준 필드 전체, 한 줄 출력 */
    public static FormatterConfig defaultConfig() {
        return FormatterConfig.builder().build();
    }

    /** 사람이 읽기 위한 설정 (들여쓰기 2칸) */
    public static FormatterConfig prettyConfig() {
        return FormatterConfig.builder()
                .jsonIndent(2)
                .build();
    }
}
