package io.github.hongjungwan.jsonlog.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * 구조화된 예외 메타데이터 (타입, 메시지, 스택 트레이스). 런타임 예외 객체와 분리된 고정 형태.
 */
@Getter
@Builder
public class ExceptionInfo {

    /** 예외 타입 (FQCN) */
    private final String type;

    /** 예외 메시지 (없으면 null) */
    private final String message;

    /** cause 체인을 포함한 스택 트레이스 텍스트 */
    private final String stackTrace;

    /** Throwable에서 ExceptionInfo 생성 */
    public static ExceptionInfo from(Throwable throwable) {
        return ExceptionInfo.builder()
                .type(throwable.getClass().getName())
                .message(throwable.getMessage())
                .stackTrace(printStackTrace(throwable))
                .build();
    }

    private static String printStackTrace(Throwable throwable) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            throwable.printStackTrace(pw);
        }
        return sw.toString().stripTrailing();
    }
}
