/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import static oracle.columnar.driver.util.LogUtil.isFineEnabled;
import static oracle.columnar.driver.util.LogUtil.logFine;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

import oracle.columnar.driver.ColumnarErrorDesc;
import oracle.columnar.driver.ColumnarException;
import oracle.columnar.driver.DeadlineExceededException;
import oracle.columnar.driver.ErrorCause;
import oracle.columnar.driver.InvalidCredentialException;
import oracle.columnar.driver.QueryException;
import oracle.columnar.driver.RequestCanceledException;
import oracle.columnar.driver.RequestDeadlineExceededException;
import oracle.columnar.driver.RequestTimeoutException;
import oracle.columnar.driver.transport.AuthenticationFailureException;
import oracle.columnar.driver.transport.TransportException;
import oracle.columnar.driver.transport.TransportTimeoutException;

/**
 * @hidden
 * Translates the failures raised by a transport into the exceptions
 * thrown to applications.
 * <p>
 * Checks run in order and the first match wins:
 * <ol>
 * <li>anything other than a {@link TransportException} is returned
 * unchanged</li>
 * <li>an HTTP 401 or an authentication failure is an
 * {@link InvalidCredentialException}</li>
 * <li>if the service reported errors, one of them identifies the failure:
 * the first one not flagged retriable, else the first one. Code 20000 is
 * an {@link InvalidCredentialException}, code 21002 a
 * {@link RequestTimeoutException}, any other code a
 * {@link QueryException}</li>
 * <li>otherwise the inner error of the transport decides: timeout,
 * cancellation, deadline, authentication, or unknown</li>
 * </ol>
 * A QueryException whose request also timed out in the transport, or
 * whose context ended, keeps the service error as its identity but is
 * tagged with the matching {@link ErrorCause}.
 */
public class ErrorClassifier {

    static final int HTTP_UNAUTHORIZED = 401;

    /* service error codes */
    static final int AUTHENTICATION_DENIED = 20000;
    static final int REQUEST_TIMEOUT = 21002;

    /* bounds the walk of cause chains */
    private static final int MAX_CAUSE_DEPTH = 32;

    private final Logger logger;

    public ErrorClassifier(Logger logger) {
        this.logger = logger;
    }

    /**
     * Translates a failure.
     *
     * @param err the failure raised by the transport
     *
     * @return the exception to throw to the application, err itself if it
     * is not a TransportException
     */
    public RuntimeException translate(RuntimeException err) {
        if (!(err instanceof TransportException)) {
            return err;
        }
        ColumnarException translated = classify((TransportException) err);
        if (isFineEnabled(logger)) {
            logFine(logger, "Transport failure classified as " +
                    translated.getErrorCause() + " (" +
                    translated.getClass().getSimpleName() + "): " +
                    err.getMessage());
        }
        return translated;
    }

    private ColumnarException classify(TransportException te) {
        Throwable inner = te.getInnerError();
        String statement = te.getStatement();
        String endpoint = te.getEndpoint();
        int status = te.getHttpResponseCode();
        List<ColumnarErrorDesc> errors = te.getErrors();

        if (status == HTTP_UNAUTHORIZED ||
            causedBy(inner, AuthenticationFailureException.class)) {
            return new InvalidCredentialException(innerMessage(te),
                                                  statement, endpoint, status,
                                                  errors, te);
        }

        if (!errors.isEmpty()) {
            ColumnarErrorDesc chosen = chooseError(errors);
            if (chosen.getCode() == AUTHENTICATION_DENIED) {
                return new InvalidCredentialException(chosen.getMessage(),
                                                      statement, endpoint,
                                                      status, errors, te);
            }
            if (chosen.getCode() == REQUEST_TIMEOUT) {
                return new RequestTimeoutException(chosen.getMessage(),
                                                   statement, endpoint,
                                                   status, errors, te);
            }

            ErrorCause errorCause = ErrorCause.QUERY_ERROR;
            if (causedBy(inner, TransportTimeoutException.class)) {
                errorCause = ErrorCause.TIMEOUT;
            } else if (causedBy(inner, CancellationException.class)) {
                errorCause = ErrorCause.CANCELED;
            } else if (causedBy(inner, DeadlineExceededException.class)) {
                errorCause = ErrorCause.DEADLINE_EXCEEDED;
            }
            return new QueryException(errorCause, chosen.getCode(),
                                      chosen.getMessage(), statement,
                                      endpoint, status, errors, te);
        }

        String msg = innerMessage(te);
        boolean notSent = te.wasNotDispatched();
        if (causedBy(inner, TransportTimeoutException.class)) {
            if (notSent) {
                msg = "operation not sent to server, as timeout would be " +
                    "exceeded";
            }
            return new RequestTimeoutException(msg, statement, endpoint,
                                               status, null, te);
        }
        if (causedBy(inner, CancellationException.class)) {
            if (notSent) {
                msg = "operation not sent to server, as context was " +
                    "cancelled";
            }
            return new RequestCanceledException(msg, statement, endpoint,
                                                status, null, te);
        }
        if (causedBy(inner, DeadlineExceededException.class)) {
            if (notSent) {
                msg = "operation not sent to server, as context deadline " +
                    "would be exceeded";
            }
            return new RequestDeadlineExceededException(msg, statement,
                                                        endpoint, status,
                                                        null, te);
        }
        if (causedBy(inner, AuthenticationFailureException.class)) {
            return new InvalidCredentialException(msg, statement, endpoint,
                                                  status, null, te);
        }
        return new ColumnarException(ErrorCause.UNKNOWN, msg, statement,
                                     endpoint, status, null, te);
    }

    /*
     * The first error not flagged retriable, or the first error.
     */
    static ColumnarErrorDesc chooseError(List<ColumnarErrorDesc> errors) {
        for (ColumnarErrorDesc desc : errors) {
            if (!desc.isRetriable()) {
                return desc;
            }
        }
        return errors.get(0);
    }

    static boolean causedBy(Throwable t, Class<? extends Throwable> type) {
        int depth = 0;
        while (t != null && depth++ < MAX_CAUSE_DEPTH) {
            if (type.isInstance(t)) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static String innerMessage(TransportException te) {
        Throwable inner = te.getInnerError();
        if (inner != null && inner.getMessage() != null) {
            return inner.getMessage();
        }
        return te.getMessage();
    }
}
