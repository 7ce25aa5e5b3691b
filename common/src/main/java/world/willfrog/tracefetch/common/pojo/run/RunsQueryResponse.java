package world.willfrog.tracefetch.common.pojo.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * POST /runs/query 的返回。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunsQueryResponse {

    private List<RawRun> runs;
}
