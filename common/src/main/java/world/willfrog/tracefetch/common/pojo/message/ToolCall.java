package world.willfrog.tracefetch.common.pojo.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCall {

    private String id;
    private String type;
    private Function function;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Function {
        private String name;
        /** 通常是 JSON 字符串；个别上游直接给对象。 */
        private JsonNode arguments;

        public String argumentsText() {
            if (arguments == null || arguments.isNull()) {
                return "";
            }
            return arguments.isTextual() ? arguments.asText() : arguments.toString();
        }
    }
}
