/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

/**
 * One error reported by the service for a failed request. A failed request
 * may carry any number of these, see {@link ColumnarException#getErrors}.
 */
public class ColumnarErrorDesc {

    private final int code;
    private final String message;
    private final boolean retriable;

    /**
     * @hidden
     * @param code the service error code
     * @param message the error message
     * @param retriable whether the service considers the error retriable
     */
    public ColumnarErrorDesc(int code, String message, boolean retriable) {
        this.code = code;
        this.message = message;
        this.retriable = retriable;
    }

    /**
     * Returns the service error code.
     *
     * @return the code
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the error message.
     *
     * @return the message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Returns whether the service flagged this error as retriable.
     *
     * @return true if retriable
     */
    public boolean isRetriable() {
        return retriable;
    }

    @Override
    public String toString() {
        return "{code=" + code + ", msg=" + message +
            ", retriable=" + retriable + "}";
    }
}
