/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import java.util.Locale;

import oracle.columnar.driver.InvalidArgumentException;

/**
 * ScanConsistency controls how current the data seen by a query must be.
 * <p>
 * {@link #NOT_BOUNDED} runs the query against whatever data is available,
 * which is the fastest option. {@link #REQUEST_PLUS} waits until all
 * mutations accepted before the query was issued are visible to it.
 * If no ScanConsistency is set the service default applies.
 */
public enum ScanConsistency {

    /**
     * No consistency guarantee, the query returns as fast as possible.
     */
    NOT_BOUNDED("not_bounded"),

    /**
     * The query sees all mutations accepted before it was issued.
     */
    REQUEST_PLUS("request_plus");

    private final String wireValue;

    ScanConsistency(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the value sent to the service.
     *
     * @return the wire value
     */
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Parses a ScanConsistency from either its wire value, such as
     * "request_plus", or its name, such as "REQUEST_PLUS". Case is
     * ignored.
     *
     * @param value the value to parse
     *
     * @return the ScanConsistency
     *
     * @throws InvalidArgumentException if the value is not recognized
     */
    public static ScanConsistency fromString(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ScanConsistency sc : values()) {
                if (sc.wireValue.equals(v) ||
                    sc.name().toLowerCase(Locale.ROOT).equals(v)) {
                    return sc;
                }
            }
        }
        throw new InvalidArgumentException("ScanConsistency",
                                           "unknown value " + value);
    }
}
