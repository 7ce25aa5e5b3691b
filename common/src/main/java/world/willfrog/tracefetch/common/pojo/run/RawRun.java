package world.willfrog.tracefetch.common.pojo.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.tracefetch.common.pojo.message.Message;

import java.util.List;
import java.util.Map;

/**
 * 远端返回的单个 run 记录。
 *
 * <p>除 id 外所有字段都可能缺失，缺失保持 null，不要补 0：未知耗时和耗时为 0 不是一回事。</p>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawRun {

    private String id;
    private String name;
    private String status;

    @JsonProperty("start_time")
    private String startTime;

    @JsonProperty("end_time")
    private String endTime;

    private Extra extra;
    private Outputs outputs;
    private List<Message> messages;

    @JsonProperty("prompt_tokens")
    private Long promptTokens;

    @JsonProperty("completion_tokens")
    private Long completionTokens;

    @JsonProperty("total_tokens")
    private Long totalTokens;

    @JsonProperty("prompt_cost")
    private Double promptCost;

    @JsonProperty("completion_cost")
    private Double completionCost;

    @JsonProperty("total_cost")
    private Double totalCost;

    @JsonProperty("first_token_time")
    private String firstTokenTime;

    /** key -> 计数；上游偶尔给非数字值，原样保留。 */
    @JsonProperty("feedback_stats")
    private Map<String, Object> feedbackStats;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Extra {
        private Map<String, Object> metadata;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Outputs {
        private List<Message> messages;
    }
}
