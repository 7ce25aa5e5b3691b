package world.willfrog.tracefetch.fetch.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.pojo.message.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 thread 预览里的 all_messages 文本还原成有序消息列表。
 *
 * <p>文本由若干条独立序列化的消息 JSON 组成，以空行分隔。历史里可能混有截断或损坏的条目，
 * 单条解析失败只丢弃该条，不影响其余条目。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageStreamParser {

    public static final String SEGMENT_SEPARATOR = "\n\n";

    private final ObjectMapper objectMapper;

    public List<Message> parse(String blob) {
        // 一段只能是一个完整 JSON 值，尾随内容视为损坏
        ObjectReader reader = objectMapper.readerFor(Message.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        List<Message> messages = new ArrayList<>();
        if (blob == null || blob.isBlank()) {
            return messages;
        }
        int dropped = 0;
        for (String segment : blob.split(SEGMENT_SEPARATOR)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                Message message = reader.readValue(trimmed);
                if (message != null) {
                    messages.add(message);
                }
            } catch (Exception e) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Skipped {} unparseable message segment(s)", dropped);
        }
        return messages;
    }
}
