package world.willfrog.tracefetch.common.exception;

/**
 * 配置缺失或非法（API Key、项目 ID 等），调用方不应重试。
 */
public class ConfigException extends TraceFetchException {

    public ConfigException(String message) {
        super(message);
    }
}
