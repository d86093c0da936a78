/**
 * Public API for the json-log formatter.
 *
 * <p>This package contains the interfaces and value types that host-framework
 * integrations and applications interact with directly.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.jsonlog.api.RecordFormatter} - Record to JSON transform</li>
 *   <li>{@link io.github.hongjungwan.jsonlog.api.domain.LogRecord} - One structured log event</li>
 *   <li>{@link io.github.hongjungwan.jsonlog.api.config.FormatterConfig} - Field selection and layout</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * RecordFormatter formatter = RecordFormatter.create(FormatterConfig.builder()
 *         .fields(List.of("timestamp", "level", "message"))
 *         .build());
 *
 * String json = formatter.format(LogRecord.builder()
 *         .timestamp(Instant.now())
 *         .level("INFO")
 *         .loggerName("payroll")
 *         .message("service started")
 *         .extra(Map.of("port", 8080))
 *         .build());
 * // {"timestamp":"2024-01-01T00:00:00.000+00:00","level":"INFO","message":"service started","port":8080}
 * }</pre>
 *
 * <p>For Logback use {@link io.github.hongjungwan.jsonlog.core.logback.JsonRecordLayout};
 * for {@code java.util.logging} use {@link io.github.hongjungwan.jsonlog.core.jul.JsonJulFormatter}.</p>
 */
package io.github.hongjungwan.jsonlog.api;
