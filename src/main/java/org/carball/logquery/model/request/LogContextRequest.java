package org.carball.logquery.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogContextRequest {

    // Epoch milliseconds of the log line to centre on
    private long timestamp;

    @JsonProperty("before_limit")
    private int beforeLimit;

    @JsonProperty("after_limit")
    private int afterLimit;
}
