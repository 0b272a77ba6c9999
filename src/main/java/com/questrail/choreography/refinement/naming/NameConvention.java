package com.questrail.choreography.refinement.naming;

/**
 * Bridges the names a program uses and the names a projection uses for the
 * same motion primitive or message type.
 * <p>
 * This is a narrow matching rule, not identifier resolution.
 */
public interface NameConvention
{
    /**
     * Returns {@code true} if the program's motion primitive name denotes the
     * projection's one.
     */
    boolean motionMatches(String programName, String projectionName);

    /**
     * Returns {@code true} if the program's message type denotes the
     * projection's one.
     */
    boolean messageMatches(String programType, String projectionType);
}
