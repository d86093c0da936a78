package io.github.hongjungwan.jsonlog.api;

import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import io.github.hongjungwan.jsonlog.api.domain.LogRecord;

/**
 * 로그 레코드 한 건을 JSON 문자열로 변환하는 포맷터.
 *
 * <p>구현체는 상태가 없으며 여러 스레드에서 동시에 호출해도 안전하다.
 * {@link #format(LogRecord)}는 어떤 입력에 대해서도 예외를 던지지 않는다.
 * 표현할 수 없는 값은 해당 필드만 문자열로 대체된다.</p>
 */
public interface RecordFormatter {

    /** 기본 설정의 JSON 포맷터 */
    static RecordFormatter create() {
        return RecordFormatterFactory.defaultFormatter();
    }

    /** 주어진 설정의 JSON 포맷터 */
    static RecordFormatter create(FormatterConfig config) {
        return RecordFormatterFactory.create(config);
    }

    /**
     * 레코드를 JSON 문자열로 변환.
     *
     * @param record 호스트 프레임워크가 넘긴 레코드
     * @return 유효한 JSON 객체 문자열 (줄바꿈 문자 없음, 들여쓰기 설정 시 제외)
     */
    String format(LogRecord record);

    /** 이 포맷터가 사용하는 설정 */
    FormatterConfig getConfig();
}
