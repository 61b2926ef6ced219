package org.carball.aql.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Result of parsing a query without running it. The transport fields {@code code} and
 * {@code error} of the server's answer are dropped.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = {"code", "error"}, ignoreUnknown = true)
public class QueryValidation {

    private Boolean parsed;

    private List<String> collections;

    @JsonProperty("bindVars")
    private List<String> bindVars;

    private JsonNode ast;

    private JsonNode warnings;
}
