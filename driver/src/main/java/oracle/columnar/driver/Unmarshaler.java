/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

/**
 * Converts the raw bytes of a result row into an application value. The
 * default, used unless one is set in {@link ColumnarConfig} or in
 * {@link oracle.columnar.driver.ops.QueryOptions}, is
 * {@link JsonUnmarshaler}.
 * <p>
 * Implementations must be thread-safe.
 */
public interface Unmarshaler {

    /**
     * Converts a row.
     *
     * @param <T> the target type
     * @param data the raw row
     * @param type the target type
     *
     * @return the converted value, may be null for a JSON null
     *
     * @throws IllegalArgumentException if the row cannot be converted to
     * the target type
     */
    <T> T unmarshal(byte[] data, Class<T> type);
}
