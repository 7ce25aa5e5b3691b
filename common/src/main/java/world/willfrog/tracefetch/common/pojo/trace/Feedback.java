package world.willfrog.tracefetch.common.pojo.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * run 上的一条反馈。value / correction 结构不固定（字符串或对象），保持原样。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Feedback {

    private String id;
    private String key;
    private Double score;
    private Object value;
    private String comment;
    private Object correction;

    @JsonProperty("created_at")
    private String createdAt;
}
