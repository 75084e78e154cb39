/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * Thrown when the metadata returned at the end of a query result cannot be
 * decoded, either because it is not well-formed JSON or because a field
 * has an unexpected type. If available the location in the JSON document
 * is provided.
 */
public class MetadataParseException extends ColumnarException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     */
    private final transient JsonLocation location;

    /**
     * @hidden
     * @param msg the exception message
     * @param location the location in the input, or null
     * @param cause the underlying parse failure, or null
     */
    public MetadataParseException(String msg,
                                  JsonLocation location,
                                  Throwable cause) {
        super(ErrorCause.METADATA_PARSE, msg, null, null, 0, null, cause);
        this.location = location;
    }

    /**
     * Returns the line number of the error if available, otherwise a
     * negative number is returned.
     *
     * @return the line, or -1
     */
    public int getLine() {
        if (location != null && location != JsonLocation.NA) {
            return location.getLineNr();
        }
        return -1;
    }

    /**
     * Returns the column number of the error within a line if available,
     * otherwise a negative number is returned.
     *
     * @return the column, or -1
     */
    public int getColumn() {
        if (location != null && location != JsonLocation.NA) {
            return location.getColumnNr();
        }
        return -1;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder("failed to decode metadata: ");
        sb.append(super.getMessage());
        if (getLine() >= 0) {
            sb.append(" at line ").append(getLine())
              .append(", column ").append(getColumn());
        }
        return sb.toString();
    }
}
