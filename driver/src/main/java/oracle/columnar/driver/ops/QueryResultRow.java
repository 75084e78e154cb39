/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import oracle.columnar.driver.Unmarshaler;

/**
 * One row of a {@link QueryResult}.
 */
public class QueryResultRow {

    private final byte[] content;
    private final Unmarshaler unmarshaler;

    /**
     * @hidden
     * @param content the raw row
     * @param unmarshaler the unmarshaler in effect for the query
     */
    public QueryResultRow(byte[] content, Unmarshaler unmarshaler) {
        this.content = content;
        this.unmarshaler = unmarshaler;
    }

    /**
     * Returns the row as sent by the service.
     *
     * @return the raw row
     */
    public byte[] getContent() {
        return content;
    }

    /**
     * Converts the row using the unmarshaler in effect for the query,
     * the {@link oracle.columnar.driver.JsonUnmarshaler} unless another
     * was configured.
     *
     * @param <T> the target type
     * @param type the target type
     *
     * @return the converted row
     *
     * @throws IllegalArgumentException if the row cannot be converted
     */
    public <T> T contentAs(Class<T> type) {
        return unmarshaler.unmarshal(content, type);
    }
}
