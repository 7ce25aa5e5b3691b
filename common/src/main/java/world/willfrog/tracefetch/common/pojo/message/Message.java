package world.willfrog.tracefetch.common.pojo.message;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一条对话消息。
 *
 * <p>上游的消息结构并不统一：{@code type}（LangChain 风格）和 {@code role}（OpenAI 风格）二选一，
 * {@code content} 可能是纯文本，也可能是内容块数组。未识别的字段原样保留，输出 raw/json 时不丢信息。</p>
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private String type;
    private String role;
    private JsonNode content;
    private String id;
    private String name;

    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> otherFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> otherFields() {
        return otherFields;
    }

    @JsonAnySetter
    public void putOtherField(String key, Object value) {
        otherFields.put(key, value);
    }

    /**
     * 消息类型，type 优先，其次 role。
     */
    public String kind() {
        if (type != null && !type.isBlank()) {
            return type;
        }
        if (role != null && !role.isBlank()) {
            return role;
        }
        return "unknown";
    }

    public boolean hasTextContent() {
        return content != null && content.isTextual();
    }

    /**
     * content 为数组时解析出的内容块；非对象元素按文本块处理。
     */
    public List<ContentItem> contentItems() {
        List<ContentItem> items = new ArrayList<>();
        if (content == null || !content.isArray()) {
            return items;
        }
        for (JsonNode node : content) {
            if (node == null || node.isNull()) {
                continue;
            }
            if (!node.isObject()) {
                items.add(new ContentItem("text", node.isTextual() ? node.asText() : node.toString(), null, null));
                continue;
            }
            items.add(new ContentItem(
                    node.hasNonNull("type") ? node.get("type").asText() : null,
                    node.hasNonNull("text") ? node.get("text").asText() : null,
                    node.hasNonNull("name") ? node.get("name").asText() : null,
                    node.get("input")
            ));
        }
        return items;
    }
}
