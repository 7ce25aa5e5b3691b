package world.willfrog.tracefetch.common.pojo.trace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.tracefetch.common.pojo.message.Message;

import java.util.List;

/**
 * 单条 trace 的拉取结果。
 *
 * <p>metadata / feedback 只在调用方要求时出现；未要求时为 null，序列化时整个字段省略，
 * 与"要求了但为空列表"区分开。</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceData {

    @JsonProperty("trace_id")
    private String traceId;

    private List<Message> messages;

    private RunMetadata metadata;

    private List<Feedback> feedback;
}
