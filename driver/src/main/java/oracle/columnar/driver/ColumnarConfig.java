/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.time.Duration;
import java.util.logging.Logger;

import oracle.columnar.driver.util.CheckNull;

/**
 * ColumnarConfig groups the parameters used to configure a
 * {@link ColumnarClient}. Once a client is created the configuration is
 * copied; changing it later does not affect the client.
 * <p>
 * Defaults:
 * <ul>
 * <li>query timeout: 10 minutes. It applies to queries whose
 * {@link RequestContext} has no deadline.</li>
 * <li>unmarshaler: {@link JsonUnmarshaler}</li>
 * <li>logger: none, the driver uses a logger named after its client
 * implementation class</li>
 * </ul>
 */
public class ColumnarConfig implements Cloneable {

    /**
     * The default query timeout.
     */
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMinutes(10);

    private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;

    private Unmarshaler unmarshaler;

    /*
     * The Logger used by the driver, or null if not configured by the user.
     */
    private Logger logger;

    /**
     * Sets the timeout of queries whose request context has no deadline.
     *
     * @param timeout the timeout
     *
     * @return this
     *
     * @throws InvalidArgumentException if the timeout is not greater than 0
     */
    public ColumnarConfig setQueryTimeout(Duration timeout) {
        CheckNull.requireNonNullIAE(
            timeout, "ColumnarConfig.setQueryTimeout: timeout must be non-null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new InvalidArgumentException("QueryTimeout",
                                               "must be greater than 0");
        }
        this.queryTimeout = timeout;
        return this;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    /**
     * Sets the unmarshaler used for result rows unless a query sets its
     * own.
     *
     * @param unmarshaler the unmarshaler
     *
     * @return this
     */
    public ColumnarConfig setUnmarshaler(Unmarshaler unmarshaler) {
        CheckNull.requireNonNullIAE(
            unmarshaler,
            "ColumnarConfig.setUnmarshaler: unmarshaler must be non-null");
        this.unmarshaler = unmarshaler;
        return this;
    }

    /**
     * Returns the unmarshaler, or null if not configured by the user.
     *
     * @return the unmarshaler
     */
    public Unmarshaler getUnmarshaler() {
        return unmarshaler;
    }

    /**
     * Sets the Logger used for the driver.
     *
     * @param logger the Logger
     *
     * @return this
     */
    public ColumnarConfig setLogger(Logger logger) {
        CheckNull.requireNonNullIAE(
            logger, "ColumnarConfig.setLogger: logger must be non-null");
        this.logger = logger;
        return this;
    }

    /**
     * Returns the Logger, or null if not configured by the user.
     *
     * @return the Logger
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * @hidden
     * Internal use only
     * @return a copy of this config
     */
    @Override
    public ColumnarConfig clone() {
        try {
            return (ColumnarConfig) super.clone();
        } catch (CloneNotSupportedException cnse) {
            throw new IllegalStateException(cnse);
        }
    }
}
