/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import java.util.Iterator;
import java.util.NoSuchElementException;

import oracle.columnar.driver.ColumnarClient;
import oracle.columnar.driver.Unmarshaler;
import oracle.columnar.driver.client.RowStreamAdapter;

import reactor.core.publisher.Flux;

/**
 * The result of a query: a stream of rows followed by
 * {@link QueryMetadata}. Rows are read from the service as they are
 * requested and can be consumed once, in the order the service produced
 * them.
 * <p>
 * A QueryResult must be closed to release the underlying stream. The
 * metadata is complete once all rows have been read or the result has
 * been closed. The best way to use a QueryResult is in a
 * try-with-resources block:
 * <pre>
 * try (QueryResult result = client.query(ctx, statement, options)) {
 *     for (QueryResultRow row : result) {
 *         Map&lt;?, ?&gt; value = row.contentAs(Map.class);
 *         // do something with the value
 *     }
 *     QueryMetadata metadata = result.getMetadata();
 * }
 * </pre>
 * A QueryResult has a single reader and is not thread-safe.
 *
 * @see ColumnarClient#query
 */
public class QueryResult implements AutoCloseable, Iterable<QueryResultRow> {

    private final RowStreamAdapter reader;
    private final Unmarshaler unmarshaler;

    /**
     * @hidden
     * @param reader the stream of the query
     * @param unmarshaler the unmarshaler in effect for the query
     */
    public QueryResult(RowStreamAdapter reader, Unmarshaler unmarshaler) {
        this.reader = reader;
        this.unmarshaler = unmarshaler;
    }

    /**
     * Returns the next row. Once the rows are exhausted this returns null
     * on every call. Call {@link #err} to find out whether the rows ended
     * because of a failure.
     *
     * @return the next row, or null if there are no more rows
     */
    public QueryResultRow nextRow() {
        byte[] content = reader.nextRow();
        if (content == null) {
            return null;
        }
        return new QueryResultRow(content, unmarshaler);
    }

    /**
     * Returns the failure that ended the rows early, if any.
     *
     * @return the failure, or null if the rows were not cut short
     */
    public RuntimeException err() {
        return reader.err();
    }

    /**
     * Returns the metadata of the query. The metadata is complete only
     * once all rows have been read or the result has been closed.
     *
     * @return the metadata
     *
     * @throws oracle.columnar.driver.MetadataParseException if the metadata
     * cannot be decoded
     * @throws oracle.columnar.driver.ColumnarException if the metadata
     * cannot be read
     */
    public QueryMetadata getMetadata() {
        return reader.metaData();
    }

    /**
     * Returns an iterator over the remaining rows. If the rows end because
     * of a failure, the failure is thrown by {@link Iterator#hasNext}.
     *
     * @return the iterator
     */
    @Override
    public Iterator<QueryResultRow> iterator() {
        return new Iterator<QueryResultRow>() {
            private QueryResultRow next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = nextRow();
                }
                if (next != null) {
                    return true;
                }
                RuntimeException err = err();
                if (err != null) {
                    throw err;
                }
                return false;
            }

            @Override
            public QueryResultRow next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                QueryResultRow row = next;
                next = null;
                return row;
            }
        };
    }

    /**
     * Returns the remaining rows as a {@link Flux}. The flux completes after
     * the last row, or signals the failure that ended the rows. Rows are
     * read on the subscribing thread, which may block; the result must
     * still be closed by the caller.
     *
     * @return the rows
     */
    public Flux<QueryResultRow> rows() {
        return Flux.generate(sink -> {
            QueryResultRow row = nextRow();
            if (row != null) {
                sink.next(row);
                return;
            }
            RuntimeException err = err();
            if (err != null) {
                sink.error(err);
            } else {
                sink.complete();
            }
        });
    }

    /**
     * Closes the result and releases the underlying stream. Calls after the
     * first have no effect.
     *
     * @throws oracle.columnar.driver.ColumnarException if the stream cannot
     * be released cleanly
     */
    @Override
    public void close() {
        reader.close();
    }
}
