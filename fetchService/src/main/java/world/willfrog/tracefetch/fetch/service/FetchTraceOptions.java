package world.willfrog.tracefetch.fetch.service;

/**
 * 单条 trace 拉取选项。两个开关都关闭时结果里不带 metadata / feedback 字段。
 */
public record FetchTraceOptions(boolean includeMetadata, boolean includeFeedback) {

    public static FetchTraceOptions messagesOnly() {
        return new FetchTraceOptions(false, false);
    }

    public boolean needsMetadata() {
        return includeMetadata || includeFeedback;
    }
}
