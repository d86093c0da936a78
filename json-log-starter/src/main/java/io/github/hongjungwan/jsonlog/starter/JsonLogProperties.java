package io.github.hongjungwan.jsonlog.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * json-log 포맷터 설정 Properties (prefix: json-log).
 */
@Data
@ConfigurationProperties(prefix = "json-log")
public class JsonLogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 출력할 표준 필드와 순서 (비어 있으면 전체) */
    private List<String> fields = new ArrayList<>();

    /** Pretty-print 들여쓰기 폭 (미설정 시 한 줄 출력) */
    private Integer jsonIndent;

    /** 타임스탬프 출력 키 */
    private String timestampKey = "timestamp";

    /** 비 ASCII 문자 이스케이프 */
    private boolean ensureAscii = false;

    /** extra 값 최대 중첩 깊이 */
    private int maxDepth = 32;
}
