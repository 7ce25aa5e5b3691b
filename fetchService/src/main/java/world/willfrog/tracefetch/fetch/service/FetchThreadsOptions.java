package world.willfrog.tracefetch.fetch.service;

import lombok.Builder;
import lombok.Data;

/**
 * 批量拉取 thread 的参数。projectUuid 为空时按配置解析，解析不到直接报错。
 */
@Data
@Builder
public class FetchThreadsOptions {

    @Builder.Default
    private int limit = 10;

    private String projectUuid;

    private Integer lastNMinutes;

    private String since;

    @Builder.Default
    private int maxConcurrent = 5;

    private ProgressListener progressListener;
}
