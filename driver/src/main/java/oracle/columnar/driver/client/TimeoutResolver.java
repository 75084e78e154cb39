/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import java.time.Duration;

import oracle.columnar.driver.RequestContext;
import oracle.columnar.driver.util.DurationUtil;

/**
 * @hidden
 * Computes the timeout sent to the service with a query.
 */
public class TimeoutResolver {

    /* added to the time remaining before the context deadline */
    static final Duration DEADLINE_MARGIN = Duration.ofSeconds(5);

    private TimeoutResolver() {}

    /**
     * Returns the timeout for a query: the time remaining until the
     * deadline of the context plus a margin if the context has a deadline,
     * otherwise the default.
     *
     * @param ctx the request context, may be null
     * @param defaultTimeout the configured query timeout
     *
     * @return the timeout as a duration string
     */
    public static String resolve(RequestContext ctx, Duration defaultTimeout) {
        return DurationUtil.format(resolveDuration(ctx, defaultTimeout));
    }

    static Duration resolveDuration(RequestContext ctx,
                                    Duration defaultTimeout) {
        if (ctx != null && ctx.hasDeadline()) {
            return ctx.getTimeRemaining().plus(DEADLINE_MARGIN);
        }
        return defaultTimeout;
    }
}
