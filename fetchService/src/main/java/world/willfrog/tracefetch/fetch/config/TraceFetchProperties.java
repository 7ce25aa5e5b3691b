package world.willfrog.tracefetch.fetch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 拉取服务配置属性。
 *
 * <p>application.yml 把 LANGSMITH_* 环境变量绑定到这里；环境变量优先于本地配置文件，
 * 本地文件的读取见 {@link LocalConfigLoader}，合并逻辑见 {@link FetchSettingsResolver}。</p>
 */
@Data
@ConfigurationProperties(prefix = "tracefetch")
public class TraceFetchProperties {

    public static final String DEFAULT_BASE_URL = "https://api.smith.langchain.com";

    /**
     * 静态 API Key，随每个请求放在 X-API-Key 头里
     */
    private String apiKey;

    /**
     * 远端地址，为空时依次回退到本地配置文件、DEFAULT_BASE_URL
     */
    private String baseUrl;

    /**
     * 项目 UUID（thread 查询必需）
     */
    private String projectUuid;

    /**
     * 项目名称，运行期通过 /sessions?name= 解析成 UUID
     */
    private String projectName;

    /**
     * 本地 YAML 配置文件路径
     */
    private String configFile;

    /**
     * 默认输出格式：raw / json / pretty
     */
    private String defaultFormat;

    private Http http = new Http();

    private Fetch fetch = new Fetch();

    private Cli cli = new Cli();

    @Data
    public static class Http {
        private int connectTimeoutSeconds = 20;
        /**
         * 单请求超时；批量拉取本身不设整体超时
         */
        private int requestTimeoutSeconds = 60;
    }

    @Data
    public static class Fetch {
        /**
         * 批量拉取时同时在途的请求上限
         */
        private int maxConcurrent = 5;
        private int traceLimit = 1;
        private int threadLimit = 10;
    }

    @Data
    public static class Cli {
        /**
         * 关闭后应用启动不解析命令行参数（嵌入使用或测试时）
         */
        private boolean enabled = true;
    }
}
