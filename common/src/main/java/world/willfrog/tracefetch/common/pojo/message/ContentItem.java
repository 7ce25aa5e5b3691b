package world.willfrog.tracefetch.common.pojo.message;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 消息内容块：文本块（text）或工具调用块（type = tool_use，带 name / input）。
 */
public record ContentItem(String type, String text, String name, JsonNode input) {

    public static final String TOOL_USE = "tool_use";

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean isToolUse() {
        return TOOL_USE.equals(type);
    }
}
