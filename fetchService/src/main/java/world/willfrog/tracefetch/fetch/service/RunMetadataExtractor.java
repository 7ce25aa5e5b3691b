package world.willfrog.tracefetch.fetch.service;

import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.pojo.run.RawRun;
import world.willfrog.tracefetch.common.pojo.trace.RunMetadata;
import world.willfrog.tracefetch.common.utils.TimestampUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RawRun -> RunMetadata，纯函数，不访问网络。
 */
@Component
public class RunMetadataExtractor {

    public RunMetadata extract(RawRun run) {
        Map<String, Object> customMetadata = run.getExtra() == null || run.getExtra().getMetadata() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(run.getExtra().getMetadata());
        Map<String, Object> feedbackStats = run.getFeedbackStats() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(run.getFeedbackStats());

        return RunMetadata.builder()
                .status(run.getStatus())
                .startTime(run.getStartTime())
                .endTime(run.getEndTime())
                .durationMs(durationMs(run.getStartTime(), run.getEndTime()))
                .customMetadata(customMetadata)
                .tokenUsage(RunMetadata.TokenUsage.builder()
                        .promptTokens(run.getPromptTokens())
                        .completionTokens(run.getCompletionTokens())
                        .totalTokens(run.getTotalTokens())
                        .build())
                .costs(RunMetadata.Costs.builder()
                        .promptCost(run.getPromptCost())
                        .completionCost(run.getCompletionCost())
                        .totalCost(run.getTotalCost())
                        .build())
                .firstTokenTime(run.getFirstTokenTime())
                .feedbackStats(feedbackStats)
                .build();
    }

    /**
     * 至少一个 feedback 计数为正数才算有反馈；非数字值忽略。
     */
    public boolean hasFeedback(RunMetadata metadata) {
        if (metadata == null || metadata.getFeedbackStats() == null) {
            return false;
        }
        for (Object value : metadata.getFeedbackStats().values()) {
            if (value instanceof Number number && number.doubleValue() > 0) {
                return true;
            }
        }
        return false;
    }

    Long durationMs(String startTime, String endTime) {
        Instant start = TimestampUtils.parseInstantOrNull(startTime);
        Instant end = TimestampUtils.parseInstantOrNull(endTime);
        if (start == null || end == null) {
            return null;
        }
        return end.toEpochMilli() - start.toEpochMilli();
    }
}
