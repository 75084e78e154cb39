/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import oracle.columnar.driver.client.ColumnarClientImpl;
import oracle.columnar.driver.client.QueryClient;
import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.QueryResult;
import oracle.columnar.driver.util.CheckNull;

import reactor.core.publisher.Mono;

/**
 * A scope within a {@link Database}. Queries run on a scope resolve
 * unqualified collection names against it, so
 * {@code scope.query(ctx, "SELECT * FROM airline", null)} reads the
 * airline collection of this scope.
 */
public class Scope {

    private final ColumnarClientImpl client;
    private final Database database;
    private final String name;
    private final QueryClient queryClient;

    /**
     * @hidden
     * @param client the client that owns this scope
     * @param database the database
     * @param name the scope name
     * @param queryClient the query client for this scope
     */
    public Scope(ColumnarClientImpl client,
                 Database database,
                 String name,
                 QueryClient queryClient) {
        this.client = client;
        this.database = database;
        this.name = name;
        this.queryClient = queryClient;
    }

    public String getName() {
        return name;
    }

    public Database getDatabase() {
        return database;
    }

    /**
     * Runs a query in this scope.
     *
     * @param ctx the request context, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return the result, which must be closed
     *
     * @see ColumnarClient#query(RequestContext, String, QueryOptions)
     */
    public QueryResult query(RequestContext ctx,
                             String statement,
                             QueryOptions options) {
        client.checkClient();
        CheckNull.requireNonNullIAE(statement,
                                    "Scope.query: statement must be non-null");
        return queryClient.query(ctx, statement, options);
    }

    /**
     * Runs a query in this scope without a deadline.
     *
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return the result, which must be closed
     */
    public QueryResult query(String statement, QueryOptions options) {
        return query(RequestContext.create(), statement, options);
    }

    /**
     * Runs a query in this scope asynchronously.
     *
     * @param ctx the request context, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return a Mono emitting the result, which must be closed
     */
    public Mono<QueryResult> queryAsync(RequestContext ctx,
                                        String statement,
                                        QueryOptions options) {
        client.checkClient();
        CheckNull.requireNonNullIAE(
            statement, "Scope.queryAsync: statement must be non-null");
        return queryClient.queryAsync(ctx, statement, options);
    }
}
