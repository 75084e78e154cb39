/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

/**
 * Thrown when a query option or a configuration value is malformed. These
 * failures are detected by the driver; the request is never sent.
 */
public class InvalidArgumentException extends ColumnarException {

    private static final long serialVersionUID = 1L;

    private final String argumentName;
    private final String reason;

    /**
     * @hidden
     * @param argumentName the name of the offending argument
     * @param reason why the value was rejected
     */
    public InvalidArgumentException(String argumentName, String reason) {
        super(ErrorCause.INVALID_ARGUMENT,
              "invalid argument: " + argumentName + " - " + reason,
              null, null, 0, null, null);
        this.argumentName = argumentName;
        this.reason = reason;
    }

    /**
     * Returns the name of the offending argument, for example
     * "ScanConsistency".
     *
     * @return the argument name
     */
    public String getArgumentName() {
        return argumentName;
    }

    /**
     * Returns why the value was rejected.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }
}
