package world.willfrog.tracefetch.fetch.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.TraceFetchException;
import world.willfrog.tracefetch.common.pojo.message.ContentItem;
import world.willfrog.tracefetch.common.pojo.message.Message;
import world.willfrog.tracefetch.common.pojo.message.ToolCall;
import world.willfrog.tracefetch.common.pojo.trace.Feedback;
import world.willfrog.tracefetch.common.pojo.trace.RunMetadata;
import world.willfrog.tracefetch.common.pojo.trace.ThreadData;
import world.willfrog.tracefetch.common.pojo.trace.TraceData;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把拉取结果渲染成文本。
 * <p>
 * raw / json 输出 JSON：带元数据时输出整条记录，否则只输出消息列表；
 * pretty 输出给人看的分段文本。
 */
@Component
@RequiredArgsConstructor
public class TraceOutputFormatter {

    private static final String BANNER = "=".repeat(60);
    private static final String RULE = "-".repeat(60);

    private final ObjectMapper objectMapper;

    public String formatTrace(TraceData trace, OutputFormat format) {
        boolean withMetadata = trace.getMetadata() != null;
        return switch (format) {
            case RAW -> toJson(withMetadata ? trace : trace.getMessages(), false);
            case JSON -> toJson(withMetadata ? trace : trace.getMessages(), true);
            case PRETTY -> withMetadata
                    ? formatPrettyWithMetadata(trace.getMetadata(), trace.getFeedback(), trace.getMessages())
                    : formatPrettyMessages(trace.getMessages());
        };
    }

    public String formatThread(ThreadData thread, OutputFormat format) {
        return formatMessages(thread.getMessages(), format);
    }

    public String formatMessages(List<Message> messages, OutputFormat format) {
        return switch (format) {
            case RAW -> toJson(messages, false);
            case JSON -> toJson(messages, true);
            case PRETTY -> formatPrettyMessages(messages);
        };
    }

    /**
     * 批量结果的 JSON 输出；pretty 对多条结果没有意义，按缩进 JSON 处理。
     */
    public String formatBatch(Object data, OutputFormat format) {
        return toJson(data, format != OutputFormat.RAW);
    }

    /**
     * trace 在批量 / 目录模式下的输出载体：带元数据时是整条记录，否则只有消息。
     */
    public Object tracePayload(TraceData trace) {
        return trace.getMetadata() != null ? trace : trace.getMessages();
    }

    public String toJson(Object data, boolean indent) {
        try {
            return indent
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data)
                    : objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new TraceFetchException("failed to serialize output", e);
        }
    }

    String formatPrettyMessages(List<Message> messages) {
        List<String> parts = new ArrayList<>();
        List<Message> safe = messages == null ? List.of() : messages;
        for (int i = 0; i < safe.size(); i++) {
            Message msg = safe.get(i);
            String kind = msg.kind();
            parts.add(BANNER);
            parts.add("Message " + (i + 1) + ": " + kind);
            parts.add(RULE);

            appendContent(parts, msg);

            if (msg.getToolCalls() != null) {
                for (ToolCall toolCall : msg.getToolCalls()) {
                    if (toolCall == null || toolCall.getFunction() == null) {
                        continue;
                    }
                    ToolCall.Function function = toolCall.getFunction();
                    parts.add("\nTool Call: " + orUnknown(function.getName()));
                    String arguments = function.argumentsText();
                    if (!arguments.isEmpty()) {
                        parts.add("Arguments: " + arguments);
                    }
                }
            }

            if ("tool".equals(kind) || hasText(msg.getName())) {
                parts.add("Tool: " + orUnknown(msg.getName()));
            }
            parts.add("");
        }
        return String.join("\n", parts);
    }

    private void appendContent(List<String> parts, Message msg) {
        JsonNode content = msg.getContent();
        if (content == null || content.isNull()) {
            return;
        }
        if (msg.hasTextContent()) {
            parts.add(content.asText());
            return;
        }
        if (!content.isArray()) {
            parts.add(content.toString());
            return;
        }
        for (ContentItem item : msg.contentItems()) {
            if (item.hasText()) {
                parts.add(item.text());
            } else if (item.isToolUse()) {
                parts.add("\nTool Call: " + orUnknown(item.name()));
                if (item.input() != null) {
                    parts.add("Input: " + toJson(item.input(), true));
                }
            }
        }
    }

    String formatPrettyWithMetadata(RunMetadata metadata, List<Feedback> feedback, List<Message> messages) {
        List<String> parts = new ArrayList<>();
        if (metadata != null) {
            parts.add(formatMetadataSection(metadata));
        }
        if (feedback != null && !feedback.isEmpty()) {
            parts.add(formatFeedbackSection(feedback));
        }
        if (!parts.isEmpty()) {
            parts.add(BANNER);
            parts.add("MESSAGES");
            parts.add(BANNER);
        }
        parts.add(formatPrettyMessages(messages));
        return String.join("\n\n", parts);
    }

    String formatMetadataSection(RunMetadata metadata) {
        List<String> lines = new ArrayList<>(List.of(BANNER, "RUN METADATA", BANNER));
        if (hasText(metadata.getStatus())) {
            lines.add("Status: " + metadata.getStatus());
        }
        if (hasText(metadata.getStartTime())) {
            lines.add("Start Time: " + metadata.getStartTime());
        }
        if (hasText(metadata.getEndTime())) {
            lines.add("End Time: " + metadata.getEndTime());
        }
        if (metadata.getDurationMs() != null) {
            lines.add("Duration: " + metadata.getDurationMs() + "ms");
        }

        RunMetadata.TokenUsage usage = metadata.getTokenUsage();
        if (usage != null && usage.hasAny()) {
            lines.add("\nToken Usage:");
            if (usage.getPromptTokens() != null) {
                lines.add("  Prompt: " + usage.getPromptTokens());
            }
            if (usage.getCompletionTokens() != null) {
                lines.add("  Completion: " + usage.getCompletionTokens());
            }
            if (usage.getTotalTokens() != null) {
                lines.add("  Total: " + usage.getTotalTokens());
            }
        }

        RunMetadata.Costs costs = metadata.getCosts();
        if (costs != null && costs.hasAny()) {
            lines.add("\nCosts:");
            if (costs.getTotalCost() != null) {
                lines.add("  Total: $" + money(costs.getTotalCost()));
            }
            if (costs.getPromptCost() != null) {
                lines.add("  Prompt: $" + money(costs.getPromptCost()));
            }
            if (costs.getCompletionCost() != null) {
                lines.add("  Completion: $" + money(costs.getCompletionCost()));
            }
        }

        Map<String, Object> custom = metadata.getCustomMetadata();
        if (custom != null && !custom.isEmpty()) {
            lines.add("\nCustom Metadata:");
            for (Map.Entry<String, Object> entry : custom.entrySet()) {
                lines.add("  " + entry.getKey() + ": " + valueText(entry.getValue()));
            }
        }

        Map<String, Object> stats = metadata.getFeedbackStats();
        if (stats != null && !stats.isEmpty()) {
            lines.add("\nFeedback Stats:");
            for (Map.Entry<String, Object> entry : stats.entrySet()) {
                lines.add("  " + entry.getKey() + ": " + valueText(entry.getValue()));
            }
        }
        return String.join("\n", lines);
    }

    String formatFeedbackSection(List<Feedback> feedback) {
        List<String> lines = new ArrayList<>(List.of(BANNER, "FEEDBACK", BANNER));
        for (int i = 0; i < feedback.size(); i++) {
            Feedback fb = feedback.get(i);
            lines.add("\nFeedback " + (i + 1) + ":");
            lines.add("  Key: " + fb.getKey());
            if (fb.getScore() != null) {
                lines.add("  Score: " + fb.getScore());
            }
            if (fb.getValue() != null) {
                lines.add("  Value: " + valueText(fb.getValue()));
            }
            if (hasText(fb.getComment())) {
                lines.add("  Comment: " + fb.getComment());
            }
            if (fb.getCorrection() != null) {
                lines.add("  Correction: " + valueText(fb.getCorrection()));
            }
            if (hasText(fb.getCreatedAt())) {
                lines.add("  Created: " + fb.getCreatedAt());
            }
        }
        return String.join("\n", lines);
    }

    private String valueText(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?> || value instanceof JsonNode) {
            return toJson(value, true);
        }
        return String.valueOf(value);
    }

    private String money(Double value) {
        return String.format(Locale.ROOT, "%.5f", value);
    }

    private String orUnknown(String value) {
        return hasText(value) ? value : "unknown";
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
