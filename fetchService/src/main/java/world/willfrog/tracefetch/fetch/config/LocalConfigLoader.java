package world.willfrog.tracefetch.fetch.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 本地 YAML 配置加载器。
 *
 * <p>文件不存在视为空配置；文件修改时间变化后，下一次 {@link #current()} 会重新加载。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final int MASKED_KEY_PREFIX = 10;

    private final TraceFetchProperties properties;

    private volatile LocalFetchConfig localConfig;
    private volatile Map<String, Object> localEntries = new LinkedHashMap<>();
    private volatile String loadedConfigPath = "";
    private volatile long loadedConfigLastModified = Long.MIN_VALUE;
    private final Object reloadLock = new Object();

    @PostConstruct
    public void load() {
        reloadIfNeeded(true);
    }

    public Optional<LocalFetchConfig> current() {
        reloadIfNeeded(false);
        return Optional.ofNullable(localConfig);
    }

    public Path configPath() {
        String file = properties.getConfigFile() == null ? "" : properties.getConfigFile().trim();
        if (file.isEmpty()) {
            return Paths.get(System.getProperty("user.home"), ".langsmith-cli", "config.yaml");
        }
        return Paths.get(file).toAbsolutePath().normalize();
    }

    /**
     * 渲染当前配置，api key 只显示前 10 位。
     */
    public String show() {
        reloadIfNeeded(false);
        Map<String, Object> entries = localEntries;
        Path path = configPath();
        StringBuilder sb = new StringBuilder();
        if (entries.isEmpty()) {
            sb.append("No configuration found\n");
            sb.append("Config file location: ").append(path).append('\n');
            return sb.toString();
        }
        sb.append("Current configuration:\n");
        sb.append("Location: ").append(path).append("\n\n");
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            String display = String.valueOf(entry.getValue());
            if ("api-key".equals(entry.getKey()) || "api_key".equals(entry.getKey())) {
                display = display.length() > MASKED_KEY_PREFIX
                        ? display.substring(0, MASKED_KEY_PREFIX) + "..."
                        : "(not set)";
            }
            sb.append("  ").append(entry.getKey()).append(": ").append(display).append('\n');
        }
        return sb.toString();
    }

    private void reloadIfNeeded(boolean force) {
        Path path = configPath();
        synchronized (reloadLock) {
            if (!Files.exists(path)) {
                if (force) {
                    log.debug("Local config file not found, skip: {}", path);
                }
                clearLocalConfigIfPresent("Local config file not found: " + path);
                return;
            }
            try {
                long currentModified = Files.getLastModifiedTime(path).toMillis();
                String normalizedPath = path.toString();
                boolean unchanged = normalizedPath.equals(loadedConfigPath) && currentModified == loadedConfigLastModified;
                if (!force && unchanged) {
                    return;
                }
                try (InputStream in = Files.newInputStream(path)) {
                    Map<String, Object> parsed = YAML_MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
                    });
                    Map<String, Object> entries = parsed == null ? new LinkedHashMap<>() : parsed;
                    this.localConfig = YAML_MAPPER.convertValue(entries, LocalFetchConfig.class);
                    this.localEntries = entries;
                    this.loadedConfigPath = normalizedPath;
                    this.loadedConfigLastModified = currentModified;
                    log.debug("Loaded local config from {} (keys={})", path, entries.keySet());
                }
            } catch (Exception e) {
                // 配置文件损坏按空配置处理，环境变量仍然可用
                log.error("Failed to load local config from {}", path, e);
                clearLocalConfigIfPresent("Local config file unreadable: " + path);
            }
        }
    }

    private void clearLocalConfigIfPresent(String reason) {
        synchronized (reloadLock) {
            if (this.localConfig != null) {
                this.localConfig = null;
                this.localEntries = new LinkedHashMap<>();
                this.loadedConfigPath = "";
                this.loadedConfigLastModified = Long.MIN_VALUE;
                log.warn("Local config cleared: {}", reason);
            }
        }
    }
}
