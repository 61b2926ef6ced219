package org.carball.aql.model.function;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user-defined AQL function as listed by the server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionDescriptor {

    /**
     * Fully qualified name, including the namespace ({@code myfunctions::temperature::celsius}).
     */
    private String name;

    /**
     * JavaScript source of the function.
     */
    private String code;

    @JsonProperty("isDeterministic")
    private Boolean deterministic;
}
