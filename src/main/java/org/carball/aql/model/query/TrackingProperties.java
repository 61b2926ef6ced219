package org.carball.aql.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query tracking settings of the server. Doubles as the partial update sent to the
 * server: fields left {@code null} are not serialized and keep their current value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackingProperties {

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("maxSlowQueries")
    private Integer maxSlowQueries;

    /**
     * Seconds after which a query counts as slow.
     */
    @JsonProperty("slowQueryThreshold")
    private Double slowQueryThreshold;

    @JsonProperty("maxQueryStringLength")
    private Integer maxQueryStringLength;

    @JsonProperty("trackBindVars")
    private Boolean trackBindVars;

    @JsonProperty("trackSlowQueries")
    private Boolean trackSlowQueries;
}
