package org.carball.aql.model.query;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A query the server is running, or one it kept in the slow query log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryStatus {

    private String id;

    private String database;

    private String user;

    private String query;

    @JsonProperty("bindVars")
    private Map<String, Object> bindVars;

    private String started;

    /**
     * Seconds the query has been running, or ran for.
     */
    @JsonProperty("runTime")
    private Double runtime;

    private String state;

    private Boolean stream;

    /**
     * Server fields without a typed property, such as {@code peakMemoryUsage}, kept as sent.
     */
    @Builder.Default
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        if (additionalProperties == null) {
            additionalProperties = new LinkedHashMap<>();
        }
        additionalProperties.put(name, value);
    }
}
