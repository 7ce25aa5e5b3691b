package world.willfrog.tracefetch.fetch.service;

/**
 * 批量拉取进度回调。每个条目结束（成功或失败）各回调一次，completed 严格递增。
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = (completed, total) -> {
    };

    void onProgress(int completed, int total);
}
