package world.willfrog.tracefetch.common.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 远端时间戳解析。
 *
 * <p>上游格式不保证统一：带 Z、带偏移（+00:00）、不带时区（按 UTC 处理）、只有日期（UTC 零点）都接受。</p>
 */
public class TimestampUtils {

    private TimestampUtils() {
    }

    /**
     * @return 解析失败或为空时返回 null，不抛异常
     */
    public static Instant parseInstantOrNull(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignore) {
            // 继续尝试无时区格式
        }
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignore) {
            // 再试纯日期
        }
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignore) {
            return null;
        }
    }

    public static String formatInstant(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
