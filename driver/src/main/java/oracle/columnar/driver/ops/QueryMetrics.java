/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import java.time.Duration;

/**
 * Execution metrics reported by the service for a query. Metrics the
 * service did not report are zero.
 */
public class QueryMetrics {

    private final Duration elapsedTime;
    private final Duration executionTime;
    private final long resultCount;
    private final long resultSize;
    private final long processedObjects;

    /**
     * @hidden
     * @param elapsedTime total time taken by the request
     * @param executionTime time taken to execute the query
     * @param resultCount number of rows returned
     * @param resultSize size of the returned rows, in bytes
     * @param processedObjects number of objects processed
     */
    public QueryMetrics(Duration elapsedTime,
                        Duration executionTime,
                        long resultCount,
                        long resultSize,
                        long processedObjects) {
        this.elapsedTime = (elapsedTime == null ? Duration.ZERO : elapsedTime);
        this.executionTime =
            (executionTime == null ? Duration.ZERO : executionTime);
        this.resultCount = resultCount;
        this.resultSize = resultSize;
        this.processedObjects = processedObjects;
    }

    /**
     * Returns the total time taken by the request, from receipt to the
     * last row.
     *
     * @return the elapsed time
     */
    public Duration getElapsedTime() {
        return elapsedTime;
    }

    /**
     * Returns the time taken to execute the query.
     *
     * @return the execution time
     */
    public Duration getExecutionTime() {
        return executionTime;
    }

    public long getResultCount() {
        return resultCount;
    }

    /**
     * Returns the size of the returned rows.
     *
     * @return the size in bytes
     */
    public long getResultSize() {
        return resultSize;
    }

    public long getProcessedObjects() {
        return processedObjects;
    }

    @Override
    public String toString() {
        return "QueryMetrics[elapsedTime=" + elapsedTime +
            ", executionTime=" + executionTime +
            ", resultCount=" + resultCount +
            ", resultSize=" + resultSize +
            ", processedObjects=" + processedObjects + "]";
    }
}
