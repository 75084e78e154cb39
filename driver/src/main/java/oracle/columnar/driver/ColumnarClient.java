/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.QueryResult;

import reactor.core.publisher.Mono;

/**
 * ColumnarClient is the interface used by applications to run queries
 * against an analytics service. Instances are created with
 * {@link ColumnarClientFactory#createClient}, are thread-safe and are
 * intended to be shared. A client must be closed when no longer needed.
 * <p>
 * Queries run on the client itself have no default database and scope;
 * use {@link #database} and {@link Database#scope} to run queries against
 * a scope.
 * <p>
 * Failures are reported with subclasses of {@link ColumnarException}:
 * <ul>
 * <li>{@link InvalidArgumentException} for malformed options, detected
 * before anything is sent</li>
 * <li>{@link InvalidCredentialException} if the service rejects the
 * credentials</li>
 * <li>{@link RequestTimeoutException}, {@link RequestCanceledException} and
 * {@link RequestDeadlineExceededException} if the request did not complete
 * in time or was cancelled</li>
 * <li>{@link QueryException} if the service rejects the statement</li>
 * <li>{@link ColumnarException} tagged {@link ErrorCause#UNKNOWN} for
 * other transport failures</li>
 * </ul>
 */
public interface ColumnarClient extends AutoCloseable {

    /**
     * Runs a query.
     *
     * @param ctx the request context carrying the deadline and
     * cancellation of the query, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return the result, which must be closed
     *
     * @throws InvalidArgumentException if an option is not valid
     * @throws ColumnarException if the query fails
     * @throws IllegalArgumentException if the statement is null
     */
    QueryResult query(RequestContext ctx,
                      String statement,
                      QueryOptions options);

    /**
     * Runs a query without a deadline. The configured query timeout
     * applies.
     *
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return the result, which must be closed
     */
    QueryResult query(String statement, QueryOptions options);

    /**
     * Runs a query asynchronously. The query is dispatched when the
     * returned Mono is subscribed to.
     *
     * @param ctx the request context, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return a Mono emitting the result, which must be closed, or the
     * failure of the query
     */
    Mono<QueryResult> queryAsync(RequestContext ctx,
                                 String statement,
                                 QueryOptions options);

    /**
     * Returns a handle on a database of the service. No request is made.
     *
     * @param name the database name
     *
     * @return the database
     */
    Database database(String name);

    /**
     * Closes the client and its transport.
     */
    @Override
    void close();
}
