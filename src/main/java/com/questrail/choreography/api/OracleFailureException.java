package com.questrail.choreography.api;

/**
 * Indicates that the external decision procedure could not answer an
 * implication query (error, timeout, {@code unknown} answer, unreadable
 * output).
 *
 * There is no approximate answer: the whole check fails.
 */
public final class OracleFailureException extends RefinementException
{
    public OracleFailureException(String reason) {
        super(reason);
    }

    public OracleFailureException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
