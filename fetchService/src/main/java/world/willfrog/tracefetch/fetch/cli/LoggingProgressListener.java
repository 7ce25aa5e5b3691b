package world.willfrog.tracefetch.fetch.cli;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.tracefetch.fetch.service.ProgressListener;

/**
 * 命令行进度输出，走日志（stderr），不污染标准输出上的结果。
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    private final String itemKind;

    public LoggingProgressListener(String itemKind) {
        this.itemKind = itemKind;
    }

    @Override
    public void onProgress(int completed, int total) {
        int percentage = total <= 0 ? 100 : completed * 100 / total;
        log.info("Fetching {}s [{}/{}] {}%", itemKind, completed, total, percentage);
    }
}
