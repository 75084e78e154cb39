/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.serde;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import oracle.columnar.driver.InvalidArgumentException;
import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.ScanConsistency;

/**
 * @hidden
 * Builds the request payload of a query from its {@link QueryOptions}.
 * <p>
 * Fields are set in a fixed order and a later field replaces an earlier one
 * with the same name: positional parameters, named parameters, scan
 * consistency, read-only, timeout, the statement and finally the raw
 * options. A raw option therefore shadows any field derived from the
 * other options, the statement included. The query context and client
 * context id are added by the caller after this and cannot be shadowed.
 */
public class QueryPayloadBuilder {

    public static final String STATEMENT = "statement";
    public static final String ARGS = "args";
    public static final String SCAN_CONSISTENCY = "scan_consistency";
    public static final String READONLY = "readonly";
    public static final String TIMEOUT = "timeout";
    public static final String QUERY_CONTEXT = "query_context";
    public static final String CLIENT_CONTEXT_ID = "client_context_id";

    /* the priority sent for a query with raised priority */
    static final int HIGH_PRIORITY = -1;

    private static final String NAMED_PARAM_PREFIX = "$";

    private QueryPayloadBuilder() {}

    /**
     * Builds the payload.
     *
     * @param statement the statement
     * @param options the options, may be null
     * @param timeout the timeout, as a duration string
     *
     * @return the payload, a mutable map that keeps insertion order
     *
     * @throws InvalidArgumentException if a named parameter has a null
     * name
     */
    public static Map<String, Object> build(String statement,
                                            QueryOptions options,
                                            String timeout) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (options == null) {
            options = new QueryOptions();
        }

        List<Object> positional = options.getPositionalParameters();
        if (positional != null) {
            payload.put(ARGS, positional);
        }

        Map<String, Object> named = options.getNamedParameters();
        if (named != null) {
            for (Map.Entry<String, Object> entry : named.entrySet()) {
                payload.put(namedParameterKey(entry.getKey()),
                            entry.getValue());
            }
        }

        ScanConsistency sc = options.getScanConsistency();
        if (sc != null) {
            payload.put(SCAN_CONSISTENCY, sc.getWireValue());
        }

        if (options.getReadOnly() != null) {
            payload.put(READONLY, options.getReadOnly());
        }

        payload.put(TIMEOUT, timeout);
        payload.put(STATEMENT, statement);

        Map<String, Object> raw = options.getRaw();
        if (raw != null) {
            payload.putAll(raw);
        }
        return payload;
    }

    /**
     * Returns the priority hint passed to the transport.
     *
     * @param options the options, may be null
     *
     * @return -1 if raised priority was requested, otherwise null
     */
    public static Integer priority(QueryOptions options) {
        if (options != null && Boolean.TRUE.equals(options.getPriority())) {
            return HIGH_PRIORITY;
        }
        return null;
    }

    /**
     * Returns the query context value for a database and scope, e.g.
     * default:`travel`.`inventory`.
     *
     * @param database the database name
     * @param scope the scope name
     *
     * @return the query context
     */
    public static String queryContext(String database, String scope) {
        return "default:`" + database + "`.`" + scope + "`";
    }

    static String namedParameterKey(String name) {
        if (name == null) {
            throw new InvalidArgumentException(
                "NamedParameters", "parameter name must be non-null");
        }
        if (name.startsWith(NAMED_PARAM_PREFIX)) {
            return name;
        }
        return NAMED_PARAM_PREFIX + name;
    }
}
