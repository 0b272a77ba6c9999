package com.questrail.choreography.refinement.config;

import com.questrail.choreography.refinement.naming.NameConvention;
import com.questrail.choreography.refinement.naming.PrefixNameConvention;
import com.questrail.choreography.refinement.observability.RefinementObservabilitySink;
import com.questrail.choreography.refinement.observability.Slf4jRefinementObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration of a refinement checker.
 *
 * @param nameConvention    how program names are matched against projection names
 * @param observabilitySink receiver of diagnostics
 * @param recordTrace       whether results carry the ordered list of removed pairs
 */
public record RefinementConfig(
    NameConvention nameConvention,
    RefinementObservabilitySink observabilitySink,
    boolean recordTrace
) {
    public RefinementConfig {
        Objects.requireNonNull(nameConvention, "nameConvention");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static RefinementConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NameConvention nameConvention = PrefixNameConvention.defaults();
        private RefinementObservabilitySink observabilitySink = new Slf4jRefinementObservabilitySink();
        private boolean recordTrace = false;

        public Builder withNameConvention(NameConvention nameConvention) {
            this.nameConvention = nameConvention;
            return this;
        }

        public Builder withObservabilitySink(RefinementObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withRecordTrace(boolean recordTrace) {
            this.recordTrace = recordTrace;
            return this;
        }

        public RefinementConfig build() {
            return new RefinementConfig(nameConvention, observabilitySink, recordTrace);
        }
    }
}
