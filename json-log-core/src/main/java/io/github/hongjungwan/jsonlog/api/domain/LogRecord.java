package io.github.hongjungwan.jsonlog.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 호스트 로깅 프레임워크가 넘겨주는 로그 레코드. 포맷터는 읽기만 한다.
 */
@Getter
public class LogRecord {

    /** 발생 시각 */
    private final Instant timestamp;

    /** 심각도 이름 (INFO, WARN, ERROR 등) */
    private final String level;

    /** 로거(채널) 이름 */
    private final String loggerName;

    /** 인자 치환이 끝난 메시지 */
    private final String message;

    /** 호출 위치: 모듈(클래스) */
    private final String module;

    /** 호출 위치: 함수(메서드) */
    private final String function;

    /** 호출 위치: 라인 번호 (알 수 없으면 0) */
    private final int line;

    /** 호출자가 넘긴 추가 필드. 삽입 순서 유지 */
    private final Map<String, Object> extra;

    /** 예외 정보 (예외 처리 중 로깅한 경우에만) */
    private final ExceptionInfo exceptionInfo;

    /** 호출자가 요청한 호출 스택 덤프 */
    private final String stackInfo;

    @Builder
    private LogRecord(Instant timestamp, String level, String loggerName, String message,
                      String module, String function, int line, Map<String, Object> extra,
                      ExceptionInfo exceptionInfo, String stackInfo) {
        this.timestamp = timestamp;
        this.level = level;
        this.loggerName = loggerName;
        this.message = message;
        this.module = module;
        this.function = function;
        this.line = line;
        this.extra = extra == null || extra.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        this.exceptionInfo = exceptionInfo;
        this.stackInfo = stackInfo;
    }
}
