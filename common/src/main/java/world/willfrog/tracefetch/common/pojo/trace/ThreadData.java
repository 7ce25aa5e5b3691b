package world.willfrog.tracefetch.common.pojo.trace;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.tracefetch.common.pojo.message.Message;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadData {

    /** 调用方给的线程标识（thread_id / session_id），不一定是远端生成的 id。 */
    @JsonProperty("thread_id")
    private String threadId;

    private List<Message> messages;
}
