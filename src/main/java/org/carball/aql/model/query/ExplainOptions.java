package org.carball.aql.model.query;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder(toBuilder = true)
public class ExplainOptions {

    /**
     * Return every plan the optimizer considered instead of only the optimal one.
     */
    @Builder.Default
    private boolean allPlans = false;

    private Integer maxPlans;

    private List<String> optimizerRules;

    public static ExplainOptions defaults() {
        return ExplainOptions.builder().build();
    }
}
