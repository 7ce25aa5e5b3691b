package world.willfrog.tracefetch.fetch.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 本地配置文件（~/.langsmith-cli/config.yaml）的结构，key 同时接受连字符和下划线两种写法。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocalFetchConfig {

    @JsonProperty("api-key")
    @JsonAlias("api_key")
    private String apiKey;

    @JsonProperty("base-url")
    @JsonAlias("base_url")
    private String baseUrl;

    @JsonProperty("project-uuid")
    @JsonAlias("project_uuid")
    private String projectUuid;

    @JsonProperty("project-name")
    @JsonAlias("project_name")
    private String projectName;

    @JsonProperty("default-format")
    @JsonAlias("default_format")
    private String defaultFormat;
}
