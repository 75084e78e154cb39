/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

/**
 * A warning reported by the service for a query that succeeded.
 */
public class QueryWarning {

    private final int code;
    private final String message;

    /**
     * @hidden
     * @param code the warning code
     * @param message the warning message
     */
    public QueryWarning(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "{code=" + code + ", msg=" + message + "}";
    }
}
