package world.willfrog.tracefetch.common.utils;

import java.util.regex.Pattern;

public class FileNameUtils {

    public static final int MAX_FILENAME_LENGTH = 255;

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_.\\-]");
    private static final Pattern EDGE_DOTS_AND_SPACES = Pattern.compile("^[.\\s]+|[.\\s]+$");

    private FileNameUtils() {
    }

    /**
     * 文件名净化：非 [A-Za-z0-9_.-] 字符替换为下划线，去掉首尾的点和空白，超长截断到 255。
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        String safe = UNSAFE_CHARS.matcher(name).replaceAll("_");
        safe = EDGE_DOTS_AND_SPACES.matcher(safe).replaceAll("");
        if (safe.length() > MAX_FILENAME_LENGTH) {
            safe = safe.substring(0, MAX_FILENAME_LENGTH);
        }
        return safe;
    }
}
