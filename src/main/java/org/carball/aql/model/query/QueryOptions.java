package org.carball.aql.model.query;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Optional settings for running a query. A {@code null} field is left out of the request
 * entirely, so the server applies its own default. {@code count} and
 * {@code memoryLimit} are always sent; a memory limit of zero means no limit.
 */
@Data
@Builder(toBuilder = true)
public class QueryOptions {

    // Cursor settings
    @Builder.Default
    private Boolean count = false;

    private Integer batchSize;

    private Integer ttl;

    private Map<String, Object> bindVars;

    private Boolean cache;

    @Builder.Default
    private Long memoryLimit = 0L;

    // Query options
    private Boolean fullCount;

    private Integer maxPlans;

    private List<String> optimizerRules;

    private Boolean failOnWarning;

    private Boolean profile;

    private Long maxTransactionSize;

    private Integer maxWarningCount;

    private Long intermediateCommitCount;

    private Long intermediateCommitSize;

    private Double satelliteSyncWait;

    // Only used in transaction mode
    private List<String> readCollections;

    private List<String> writeCollections;

    public static QueryOptions defaults() {
        return QueryOptions.builder().build();
    }
}
