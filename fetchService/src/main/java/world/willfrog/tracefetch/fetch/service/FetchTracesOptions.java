package world.willfrog.tracefetch.fetch.service;

import lombok.Builder;
import lombok.Data;

/**
 * 批量拉取 trace 的参数。
 */
@Data
@Builder
public class FetchTracesOptions {

    @Builder.Default
    private int limit = 1;

    /** 为空时按配置解析项目。 */
    private String projectUuid;

    private Integer lastNMinutes;

    private String since;

    @Builder.Default
    private int maxConcurrent = 5;

    private boolean includeMetadata;

    private boolean includeFeedback;

    private ProgressListener progressListener;
}
