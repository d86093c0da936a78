package io.github.hongjungwan.jsonlog.starter;

import io.github.hongjungwan.jsonlog.api.RecordFormatter;
import io.github.hongjungwan.jsonlog.api.RecordFormatterFactory;
import io.github.hongjungwan.jsonlog.api.config.FormatterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * json-log Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(JsonLogProperties.class)
@ConditionalOnProperty(prefix = "json-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class JsonLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FormatterConfig formatterConfig(JsonLogProperties properties) {
        return FormatterConfig.builder()
                .fields(properties.getFields() == null ? List.of() : List.copyOf(properties.getFields()))
                .jsonIndent(properties.getJsonIndent())
                .timestampKey(properties.getTimestampKey())
                .ensureAscii(properties.isEnsureAscii())
                .maxDepth(properties.getMaxDepth())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordFormatter recordFormatter(FormatterConfig config) {
        RecordFormatter formatter = RecordFormatterFactory.create(config);
        log.info("json-log formatter configured: fields={}, jsonIndent={}, timestampKey={}",
                config.getFields() == null || config.getFields().isEmpty() ? "default" : config.getFields(),
                config.getJsonIndent(), config.getTimestampKey());
        return formatter;
    }
}
