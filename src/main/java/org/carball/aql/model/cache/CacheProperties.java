package org.carball.aql.model.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query results cache settings. Used both for reading the settings and as a partial
 * update, in which case {@code null} fields are left unchanged on the server.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheProperties {

    @JsonProperty("mode")
    private CacheMode mode;

    /**
     * Maximum number of query results kept per database.
     */
    @JsonProperty("maxResults")
    private Long limit;
}
