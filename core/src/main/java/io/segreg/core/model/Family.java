package io.segreg.core.model;

import java.util.List;
import java.util.Locale;

/** Response distribution families and the links each one accepts. */
public enum Family {
    GAUSSIAN("gaussian", List.of(Link.IDENTITY, Link.LOG)),
    BINOMIAL("binomial", List.of(Link.LOGIT, Link.PROBIT, Link.IDENTITY)),
    BERNOULLI("bernoulli", List.of(Link.LOGIT, Link.PROBIT, Link.IDENTITY)),
    POISSON("poisson", List.of(Link.LOG, Link.IDENTITY));

    private final String id;
    private final List<Link> links;

    Family(String id, List<Link> links) {
        this.id = id;
        this.links = links;
    }

    /** The family name as written in model definitions. */
    public String id() {
        return id;
    }

    /** Accepted links; the first one is the default. */
    public List<Link> links() {
        return links;
    }

    /** The link used when a definition names none. */
    public Link defaultLink() {
        return links.get(0);
    }

    /** Returns {@code true} if the family has a standard-deviation parameter. */
    public boolean hasSigma() {
        return this == GAUSSIAN;
    }

    /**
     * Looks up a family by name, case-insensitively.
     *
     * @return the family, or {@code null} if the name is not recognized
     */
    public static Family fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Family family : values()) {
            if (family.id.equals(normalized)) {
                return family;
            }
        }
        return null;
    }
}
