package com.questrail.choreography.refinement.naming;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link NameConvention} driven by explicit tables from program names to
 * projection names. Names without an entry fall back to exact equality.
 */
public final class MappingNameConvention implements NameConvention
{
    private final Map<String, String> motions;
    private final Map<String, String> messages;

    private MappingNameConvention(Map<String, String> motions, Map<String, String> messages) {
        this.motions = Map.copyOf(motions);
        this.messages = Map.copyOf(messages);
    }

    @Override
    public boolean motionMatches(String programName, String projectionName) {
        return projectionName.equals(motions.getOrDefault(programName, programName));
    }

    @Override
    public boolean messageMatches(String programType, String projectionType) {
        return projectionType.equals(messages.getOrDefault(programType, programType));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> motions = new HashMap<>();
        private final Map<String, String> messages = new HashMap<>();

        private Builder() {}

        public Builder mapMotion(String programName, String projectionName) {
            motions.put(Objects.requireNonNull(programName, "programName"),
                    Objects.requireNonNull(projectionName, "projectionName"));
            return this;
        }

        public Builder mapMessage(String programType, String projectionType) {
            messages.put(Objects.requireNonNull(programType, "programType"),
                    Objects.requireNonNull(projectionType, "projectionType"));
            return this;
        }

        public MappingNameConvention build() {
            return new MappingNameConvention(motions, messages);
        }
    }
}
