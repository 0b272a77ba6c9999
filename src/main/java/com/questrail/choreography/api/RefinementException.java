package com.questrail.choreography.api;

/**
 * Base type of the fatal failures of a refinement check.
 *
 * A {@code RefinementException} aborts the check it was raised in: there is no
 * partial verdict. Ordinary incompatibility between a program point and a
 * projection state is never reported through this type; it simply shrinks the
 * refinement relation.
 */
public abstract class RefinementException extends RuntimeException
{
    protected RefinementException(String message) {
        super(message);
    }

    protected RefinementException(String message, Throwable cause) {
        super(message, cause);
    }
}
