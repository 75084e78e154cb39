/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import java.util.Collections;
import java.util.List;

/**
 * The metadata that follows the rows of a query result: the request id,
 * execution metrics and warnings. It is only complete once every row has
 * been read or the result closed.
 *
 * @see QueryResult#getMetadata
 */
public class QueryMetadata {

    private final String requestId;
    private final QueryMetrics metrics;
    private final List<QueryWarning> warnings;

    /**
     * @hidden
     * @param requestId the request id assigned by the service, or null
     * @param metrics the metrics
     * @param warnings the warnings, or null if there are none
     */
    public QueryMetadata(String requestId,
                         QueryMetrics metrics,
                         List<QueryWarning> warnings) {
        this.requestId = (requestId == null ? "" : requestId);
        this.metrics = (metrics == null ?
                        new QueryMetrics(null, null, 0, 0, 0) : metrics);
        this.warnings = (warnings == null ? Collections.emptyList() :
                         Collections.unmodifiableList(warnings));
    }

    /**
     * Returns the id the service assigned to the request.
     *
     * @return the request id, empty if not reported
     */
    public String getRequestId() {
        return requestId;
    }

    public QueryMetrics getMetrics() {
        return metrics;
    }

    /**
     * Returns the warnings reported by the service.
     *
     * @return the warnings, possibly empty
     */
    public List<QueryWarning> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "QueryMetadata[requestId=" + requestId +
            ", metrics=" + metrics + ", warnings=" + warnings + "]";
    }
}
