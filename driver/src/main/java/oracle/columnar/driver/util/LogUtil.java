/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging. All methods tolerate a null
 * logger, in which case nothing is logged.
 */
public class LogUtil {

    public static boolean isFineEnabled(Logger logger) {
        return logger != null && logger.isLoggable(Level.FINE);
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Returns a statement suitable for a log line. Long statements are
     * truncated, and parameters are never logged.
     *
     * @param statement the query statement, may be null
     *
     * @return the statement, possibly truncated
     */
    public static String statementForLog(String statement) {
        if (statement == null) {
            return "null";
        }
        if (statement.length() <= MAX_LOGGED_STATEMENT) {
            return statement;
        }
        return statement.substring(0, MAX_LOGGED_STATEMENT) + "...";
    }

    private static final int MAX_LOGGED_STATEMENT = 256;
}
