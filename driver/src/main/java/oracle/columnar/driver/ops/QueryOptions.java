/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import oracle.columnar.driver.Unmarshaler;
import oracle.columnar.driver.util.CheckNull;

/**
 * Options for a single query. All options are optional; a null
 * QueryOptions is the same as an empty one.
 * <p>
 * Parameters may be supplied positionally, referenced as $1, $2 ... in
 * the statement, or by name. A leading "$" is added to named parameter
 * names that lack one, so "id" and "$id" name the same parameter.
 * <p>
 * Raw options are copied verbatim into the request sent to the service
 * after the parameters, so a raw option can replace a value derived from
 * any other option of this class, including the statement and the
 * timeout. It cannot replace the query context or the client context id,
 * which the driver adds last.
 * <pre>
 * QueryOptions opts = new QueryOptions()
 *     .addNamedParameter("country", "France")
 *     .setScanConsistency(ScanConsistency.REQUEST_PLUS)
 *     .setReadOnly(true);
 * </pre>
 */
public class QueryOptions {

    private List<Object> positionalParameters;
    private Map<String, Object> namedParameters;
    private Map<String, Object> raw;
    private ScanConsistency scanConsistency;
    private Boolean readOnly;
    private Boolean priority;
    private Unmarshaler unmarshaler;

    /**
     * Sets the positional parameters, replacing any set before.
     *
     * @param parameters the parameters, in order, or null to clear them
     *
     * @return this
     */
    public QueryOptions setPositionalParameters(List<?> parameters) {
        positionalParameters =
            (parameters == null ? null : new ArrayList<>(parameters));
        return this;
    }

    /**
     * Appends a positional parameter.
     *
     * @param value the parameter value, may be null
     *
     * @return this
     */
    public QueryOptions addPositionalParameter(Object value) {
        if (positionalParameters == null) {
            positionalParameters = new ArrayList<>();
        }
        positionalParameters.add(value);
        return this;
    }

    /**
     * Returns the positional parameters.
     *
     * @return the parameters or null if not set
     */
    public List<Object> getPositionalParameters() {
        return positionalParameters == null ? null :
            Collections.unmodifiableList(positionalParameters);
    }

    /**
     * Sets the named parameters, replacing any set before.
     *
     * @param parameters the parameters keyed by name, or null to clear them
     *
     * @return this
     */
    public QueryOptions setNamedParameters(Map<String, ?> parameters) {
        namedParameters =
            (parameters == null ? null : new LinkedHashMap<>(parameters));
        return this;
    }

    /**
     * Adds a named parameter.
     *
     * @param name the parameter name, with or without the leading "$"
     * @param value the parameter value, may be null
     *
     * @return this
     */
    public QueryOptions addNamedParameter(String name, Object value) {
        CheckNull.requireNonNullIAE(
            name, "QueryOptions.addNamedParameter: name must be non-null");
        if (namedParameters == null) {
            namedParameters = new LinkedHashMap<>();
        }
        namedParameters.put(name, value);
        return this;
    }

    /**
     * Returns the named parameters as supplied, without name normalization.
     *
     * @return the parameters or null if not set
     */
    public Map<String, Object> getNamedParameters() {
        return namedParameters == null ? null :
            Collections.unmodifiableMap(namedParameters);
    }

    /**
     * Sets raw options, replacing any set before. Each entry is sent to
     * the service as is, keyed by its wire field name.
     *
     * @param raw the raw options, or null to clear them
     *
     * @return this
     */
    public QueryOptions setRaw(Map<String, ?> raw) {
        this.raw = (raw == null ? null : new LinkedHashMap<>(raw));
        return this;
    }

    /**
     * Adds a raw option.
     *
     * @param field the wire field name
     * @param value the value
     *
     * @return this
     */
    public QueryOptions putRaw(String field, Object value) {
        CheckNull.requireNonEmptyIAE(
            field, "QueryOptions.putRaw: field must be non-empty");
        if (raw == null) {
            raw = new LinkedHashMap<>();
        }
        raw.put(field, value);
        return this;
    }

    /**
     * Returns the raw options.
     *
     * @return the raw options or null if not set
     */
    public Map<String, Object> getRaw() {
        return raw == null ? null : Collections.unmodifiableMap(raw);
    }

    /**
     * Sets the scan consistency.
     *
     * @param scanConsistency the scan consistency, or null for the service
     * default
     *
     * @return this
     */
    public QueryOptions setScanConsistency(ScanConsistency scanConsistency) {
        this.scanConsistency = scanConsistency;
        return this;
    }

    public ScanConsistency getScanConsistency() {
        return scanConsistency;
    }

    /**
     * Sets whether the query is read-only. When set, to either value, it
     * is sent to the service; the service rejects a read-only query that
     * modifies data.
     *
     * @param readOnly true, false or null to not send the option
     *
     * @return this
     */
    public QueryOptions setReadOnly(Boolean readOnly) {
        this.readOnly = readOnly;
        return this;
    }

    public Boolean getReadOnly() {
        return readOnly;
    }

    /**
     * Sets whether the query should be run with raised priority.
     *
     * @param priority true to raise the priority
     *
     * @return this
     */
    public QueryOptions setPriority(Boolean priority) {
        this.priority = priority;
        return this;
    }

    public Boolean getPriority() {
        return priority;
    }

    /**
     * Sets the unmarshaler used for the rows of this query, overriding the
     * one of the client configuration.
     *
     * @param unmarshaler the unmarshaler or null to use the default
     *
     * @return this
     */
    public QueryOptions setUnmarshaler(Unmarshaler unmarshaler) {
        this.unmarshaler = unmarshaler;
        return this;
    }

    public Unmarshaler getUnmarshaler() {
        return unmarshaler;
    }
}
