/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

/**
 * The result stream of a dispatched query. Rows are returned in the order
 * the service produced them; the metadata follows the last row. A stream
 * has a single reader and is not thread-safe.
 */
public interface RowStream {

    /**
     * Returns the next row.
     *
     * @return the raw row, or null if there are no more rows or the stream
     * failed, see {@link #err}
     */
    byte[] nextRow();

    /**
     * Returns the raw metadata that follows the rows. It is complete only
     * once all rows were read.
     *
     * @return the metadata as JSON
     *
     * @throws TransportException if the metadata cannot be read
     */
    byte[] metaData();

    /**
     * Returns the error that ended the stream early, if any.
     *
     * @return the error or null
     */
    RuntimeException err();

    /**
     * Releases the stream. Implementations are not required to tolerate
     * more than one call.
     *
     * @throws TransportException if the stream cannot be released cleanly
     */
    void close();
}
