package world.willfrog.tracefetch.common.pojo.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GET /runs/threads/{id}?select=all_messages 的返回，只关心合并后的消息文本。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreadPreviewResponse {

    private Previews previews;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Previews {
        /** 多条消息的 JSON，以空行（\n\n）分隔。 */
        @JsonProperty("all_messages")
        private String allMessages;
    }
}
