package io.segreg.core.model;

import java.util.Locale;
import org.apache.commons.math3.distribution.NormalDistribution;

/** Link functions relating the linear predictor to the response distribution parameter. */
public enum Link {
    IDENTITY("identity") {
        @Override
        public double apply(double mu) {
            return mu;
        }

        @Override
        public double inverse(double eta) {
            return eta;
        }
    },
    LOG("log") {
        @Override
        public double apply(double mu) {
            return Math.log(mu);
        }

        @Override
        public double inverse(double eta) {
            return Math.exp(eta);
        }
    },
    LOGIT("logit") {
        @Override
        public double apply(double mu) {
            return Math.log(mu / (1 - mu));
        }

        @Override
        public double inverse(double eta) {
            return 1 / (1 + Math.exp(-eta));
        }
    },
    PROBIT("probit") {
        private final NormalDistribution standard = new NormalDistribution(0, 1);

        @Override
        public double apply(double mu) {
            return standard.inverseCumulativeProbability(mu);
        }

        @Override
        public double inverse(double eta) {
            return standard.cumulativeProbability(eta);
        }
    };

    private final String id;

    Link(String id) {
        this.id = id;
    }

    /** The link name as written in model definitions. */
    public String id() {
        return id;
    }

    /** Maps a response-scale value to the link scale. */
    public abstract double apply(double mu);

    /** Maps a link-scale value to the response scale. */
    public abstract double inverse(double eta);

    /**
     * Looks up a link by name, case-insensitively.
     *
     * @return the link, or {@code null} if the name is not recognized
     */
    public static Link fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Link link : values()) {
            if (link.id.equals(normalized)) {
                return link;
            }
        }
        return null;
    }
}
