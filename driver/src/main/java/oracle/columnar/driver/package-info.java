/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the public API for running queries against a columnar analytics
 * service, along with the configuration and exception classes used by
 * applications. Option, result and metadata classes used for individual
 * queries are in the
 * <a href="{@docRoot}/oracle/columnar/driver/ops/package-summary.html#package.description">
 * ops package.
 * </a>
 * <p>
 * The overall flow of a driver application is:
 * <ol>
 * <li>Create a {@link oracle.columnar.driver.ColumnarConfig} and a
 * {@link oracle.columnar.driver.transport.ColumnarTransport} connected to
 * the service.</li>
 * <li>Use them to obtain a {@link oracle.columnar.driver.ColumnarClient}
 * from {@link oracle.columnar.driver.ColumnarClientFactory}.</li>
 * <li>Run queries on the client, or on a
 * {@link oracle.columnar.driver.Scope} obtained from a
 * {@link oracle.columnar.driver.Database}. Each query returns a
 * {@link oracle.columnar.driver.ops.QueryResult} that must be closed.</li>
 * </ol>
 * Errors are thrown as exceptions. Failures of the service or transport are
 * instances of {@link oracle.columnar.driver.ColumnarException}, tagged with
 * an {@link oracle.columnar.driver.ErrorCause}. Common Java exceptions such
 * as {@link java.lang.IllegalArgumentException} are thrown directly.
 * <p>
 * A {@link oracle.columnar.driver.RequestContext} bounds a query: cancelling
 * it, or reaching its deadline, ends the query and the reading of its rows.
 * <p>
 * <strong>Logging in the SDK</strong>
 * <p>
 * The SDK uses logging as provided by the <i>java.util.logging</i> package.
 * If nothing goes wrong there is little or no logging. Dispatched queries
 * and error classification are logged at FINE. A logger can be passed with
 * {@link oracle.columnar.driver.ColumnarConfig#setLogger}, or configured
 * with a logging properties file:
 * <pre>
handlers=java.util.logging.ConsoleHandler
java.util.logging.ConsoleHandler.level=ALL
java.util.logging.SimpleFormatter.format=%1$tF %1$tT %4$-7s %5$s %n
oracle.columnar.level=FINE
 * </pre>
 */
package oracle.columnar.driver;
