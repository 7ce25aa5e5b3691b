package world.willfrog.tracefetch.common.pojo.trace;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * run 的归一化元数据。
 *
 * <p>customMetadata / feedbackStats 保证非 null，下游可以直接遍历。</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunMetadata {

    private String status;

    @JsonProperty("start_time")
    private String startTime;

    @JsonProperty("end_time")
    private String endTime;

    /** 起止时间都能解析时才有值。 */
    @JsonProperty("duration_ms")
    private Long durationMs;

    @JsonProperty("custom_metadata")
    private Map<String, Object> customMetadata;

    @JsonProperty("token_usage")
    private TokenUsage tokenUsage;

    private Costs costs;

    @JsonProperty("first_token_time")
    private String firstTokenTime;

    @JsonProperty("feedback_stats")
    private Map<String, Object> feedbackStats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenUsage {
        @JsonProperty("prompt_tokens")
        private Long promptTokens;

        @JsonProperty("completion_tokens")
        private Long completionTokens;

        @JsonProperty("total_tokens")
        private Long totalTokens;

        public boolean hasAny() {
            return promptTokens != null || completionTokens != null || totalTokens != null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Costs {
        @JsonProperty("prompt_cost")
        private Double promptCost;

        @JsonProperty("completion_cost")
        private Double completionCost;

        @JsonProperty("total_cost")
        private Double totalCost;

        public boolean hasAny() {
            return promptCost != null || completionCost != null || totalCost != null;
        }
    }
}
