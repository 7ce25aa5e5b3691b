package world.willfrog.tracefetch.fetch.output;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.TraceFetchException;
import world.willfrog.tracefetch.common.utils.FileNameUtils;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 输出落地：标准输出、单个文件，或目录模式下一条记录一个 JSON 文件。
 */
@Component
@Slf4j
public class OutputWriter {

    public static final String JSON_SUFFIX = ".json";

    private static final Pattern UUID_LIKE = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INDEX_PLACEHOLDER = Pattern.compile("\\{index[^}]*}");
    private static final Pattern IDX_PLACEHOLDER = Pattern.compile("\\{idx[^}]*}");

    private final PrintStream stdout;

    public OutputWriter() {
        this(System.out);
    }

    public OutputWriter(PrintStream stdout) {
        this.stdout = stdout;
    }

    /**
     * file 为空时写标准输出，否则写入文件（父目录不存在会创建）。
     */
    public void write(String content, String file) {
        if (file == null || file.isBlank()) {
            stdout.print(content);
            stdout.flush();
            return;
        }
        Path path = Path.of(file).toAbsolutePath().normalize();
        writeFile(path, content);
        log.info("Saved output to {}", path);
    }

    /**
     * 准备目录模式的输出目录。
     *
     * @throws IllegalArgumentException 参数看起来是个 UUID 而不是目录
     */
    public Path prepareDirectory(String dir, String itemKind) {
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("output directory is empty");
        }
        if (looksLikeUuid(dir)) {
            throw new IllegalArgumentException("'" + dir + "' looks like a " + itemKind + " ID, not a directory path. "
                    + "To fetch a specific " + itemKind + " by ID, use the '" + itemKind + " <id>' command");
        }
        Path path = Path.of(dir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new TraceFetchException("failed to create output directory: " + path, e);
        }
        return path;
    }

    /**
     * 按文件名模板生成安全的文件名。
     *
     * @param pattern       模板，支持 {idPlaceholder}、{index}、{idx}
     * @param idPlaceholder id 占位符名，如 trace_id / thread_id
     * @param id            记录 id
     * @param index         从 1 开始的序号
     */
    public String fileName(String pattern, String idPlaceholder, String id, int index) {
        Pattern idPattern = Pattern.compile("\\{" + Pattern.quote(idPlaceholder) + "[^}]*}");
        String name = idPattern.matcher(pattern).replaceAll(Matcher.quoteReplacement(id == null ? "" : id));
        name = INDEX_PLACEHOLDER.matcher(name).replaceAll(String.valueOf(index));
        name = IDX_PLACEHOLDER.matcher(name).replaceAll(String.valueOf(index));
        String safe = FileNameUtils.sanitize(name);
        return safe.endsWith(JSON_SUFFIX) ? safe : safe + JSON_SUFFIX;
    }

    public Path writeToDirectory(Path dir, String fileName, String content) {
        Path target = dir.resolve(fileName);
        writeFile(target, content);
        return target;
    }

    public boolean looksLikeUuid(String value) {
        return value != null && UUID_LIKE.matcher(value.trim()).matches();
    }

    private void writeFile(Path path, String content) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TraceFetchException("failed to write output file: " + path, e);
        }
    }
}
