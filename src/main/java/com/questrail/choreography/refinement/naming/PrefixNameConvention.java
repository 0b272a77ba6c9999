package com.questrail.choreography.refinement.naming;

import java.util.Locale;
import java.util.Objects;

/**
 * Default {@link NameConvention}: names match if they are equal ignoring case,
 * or if the program name is the projection name behind a fixed prefix
 * ({@code m_} for motion primitives, {@code msg_} for message types).
 */
public final class PrefixNameConvention implements NameConvention
{
    public static final String MOTION_PREFIX = "m_";
    public static final String MESSAGE_PREFIX = "msg_";

    private static final PrefixNameConvention DEFAULTS = new PrefixNameConvention(MOTION_PREFIX, MESSAGE_PREFIX);

    private final String motionPrefix;
    private final String messagePrefix;

    public PrefixNameConvention(String motionPrefix, String messagePrefix) {
        this.motionPrefix = Objects.requireNonNull(motionPrefix, "motionPrefix").toLowerCase(Locale.ROOT);
        this.messagePrefix = Objects.requireNonNull(messagePrefix, "messagePrefix").toLowerCase(Locale.ROOT);
    }

    public static PrefixNameConvention defaults() {
        return DEFAULTS;
    }

    @Override
    public boolean motionMatches(String programName, String projectionName) {
        return matches(motionPrefix, programName, projectionName);
    }

    @Override
    public boolean messageMatches(String programType, String projectionType) {
        return matches(messagePrefix, programType, projectionType);
    }

    private static boolean matches(String prefix, String programName, String projectionName) {
        String l1 = programName.toLowerCase(Locale.ROOT);
        String l2 = projectionName.toLowerCase(Locale.ROOT);
        return l1.equals(l2) || l1.equals(prefix + l2);
    }
}
