package world.willfrog.tracefetch.fetch.service;

import world.willfrog.tracefetch.common.utils.TimestampUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 查询的起始时间窗口：最近 N 分钟，或某个时间点之后，二选一。
 *
 * @param lastNMinutes 最近 N 分钟，null 表示未设置
 * @param since        ISO-8601 时间点，null / 空白表示未设置
 */
public record TimeWindow(Integer lastNMinutes, String since) {

    public static final TimeWindow NONE = new TimeWindow(null, null);

    public TimeWindow {
        since = since == null || since.isBlank() ? null : since.trim();
        if (lastNMinutes != null && since != null) {
            throw new IllegalArgumentException("--last-n-minutes and --since are mutually exclusive");
        }
        if (lastNMinutes != null && lastNMinutes < 0) {
            throw new IllegalArgumentException("--last-n-minutes must not be negative: " + lastNMinutes);
        }
        if (since != null && TimestampUtils.parseInstantOrNull(since) == null) {
            throw new IllegalArgumentException("--since is not a valid ISO-8601 timestamp: " + since);
        }
    }

    public static TimeWindow of(Integer lastNMinutes, String since) {
        return new TimeWindow(lastNMinutes, since);
    }

    public Optional<Instant> startTime(Clock clock) {
        if (lastNMinutes != null) {
            return Optional.of(clock.instant().minus(Duration.ofMinutes(lastNMinutes)));
        }
        if (since != null) {
            return Optional.of(TimestampUtils.parseInstantOrNull(since));
        }
        return Optional.empty();
    }
}
