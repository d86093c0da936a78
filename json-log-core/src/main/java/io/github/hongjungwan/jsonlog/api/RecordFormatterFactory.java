package io.github.hongjungwan.jsonlog.api;

import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import io.github.hongjungwan.jsonlog.core.internal.JsonRecordFormatter;

/**
 * RecordFormatter 인스턴스 팩토리.
 */
public final class RecordFormatterFactory {

    private static final RecordFormatter DEFAULT_FORMATTER =
            new JsonRecordFormatter(FormatterConfig.defaultConfig());

    private RecordFormatterFactory() {}

    /** 기본 설정 포맷터 (공유 인스턴스) */
    public static RecordFormatter defaultFormatter() {
        return DEFAULT_FORMATTER;
    }

    /**
     * 설정 기반 포맷터 생성.
     *
     * @throws IllegalArgumentException 들여쓰기가 음수이거나 타임스탬프 키가 비어 있는 경우
     */
    public static RecordFormatter create(FormatterConfig config) {
        return new JsonRecordFormatter(config);
    }
}
