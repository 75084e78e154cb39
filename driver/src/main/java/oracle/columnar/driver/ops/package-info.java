/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the option and result classes used for queries.
 * {@link oracle.columnar.driver.ops.QueryOptions} holds the optional
 * parameters of a query; it is not validated until the query is run.
 * {@link oracle.columnar.driver.ops.QueryResult} streams the rows of a
 * query and, once they have been read, its
 * {@link oracle.columnar.driver.ops.QueryMetadata}.
 * <p>
 * Options and results are not thread-safe and not intended to be shared.
 */
package oracle.columnar.driver.ops;
