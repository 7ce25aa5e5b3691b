package world.willfrog.tracefetch.fetch.format;

import java.util.Locale;

public enum OutputFormat {
    /** 紧凑 JSON */
    RAW,
    /** 缩进 JSON */
    JSON,
    /** 人类可读文本 */
    PRETTY;

    public static OutputFormat parseOrDefault(String value, OutputFormat fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    /**
     * 命令行显式指定的格式，非法值直接报错。
     */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("output format is empty, expected raw, json or pretty");
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported output format: " + value + ", expected raw, json or pretty");
        }
    }
}
