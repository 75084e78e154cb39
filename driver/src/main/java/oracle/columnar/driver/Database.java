/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import oracle.columnar.driver.client.ColumnarClientImpl;
import oracle.columnar.driver.util.CheckNull;

/**
 * A database of the analytics service. Databases contain scopes, which
 * provide the default context of the queries run on them.
 *
 * @see ColumnarClient#database
 */
public class Database {

    private final ColumnarClientImpl client;
    private final String name;

    /**
     * @hidden
     * @param client the client
     * @param name the database name
     */
    public Database(ColumnarClientImpl client, String name) {
        this.client = client;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns a handle on a scope of this database. No request is made.
     *
     * @param scopeName the scope name
     *
     * @return the scope
     *
     * @throws IllegalStateException if the client has been closed
     */
    public Scope scope(String scopeName) {
        client.checkClient();
        CheckNull.requireNonEmptyIAE(
            scopeName, "Database.scope: scope name must be non-empty");
        return new Scope(client, this, scopeName,
                         client.newQueryClient(name, scopeName));
    }
}
