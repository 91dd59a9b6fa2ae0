package io.segreg.core.model;

import io.segreg.core.error.FamilyLinkException;
import java.util.Objects;

/**
 * A validated family/link combination.
 *
 * @param family the response family
 * @param link   a link accepted by {@code family}
 */
public record FamilyLink(Family family, Link link) {

    /** Gaussian family with identity link. */
    public static final FamilyLink GAUSSIAN = new FamilyLink(Family.GAUSSIAN, Link.IDENTITY);

    public FamilyLink {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(link, "link must not be null");
        if (!family.links().contains(link)) {
            throw new IllegalArgumentException(
                    "Link '" + link.id() + "' is not valid for family '" + family.id() + "'");
        }
    }

    /**
     * Resolves a family/link pair from their names. A {@code null} link selects the family's
     * default link.
     *
     * @param familyName family name, e.g. {@code gaussian}
     * @param linkName   link name, e.g. {@code identity}, or {@code null}
     * @param modelId    model identifier for error messages
     * @throws FamilyLinkException if either name is unknown or the pair is not recognized
     */
    public static FamilyLink of(String familyName, String linkName, String modelId) {
        Family family = Family.fromId(familyName == null ? Family.GAUSSIAN.id() : familyName);
        if (family == null) {
            throw new FamilyLinkException("Unknown family '" + familyName + "'", modelId, null);
        }
        if (linkName == null) {
            return new FamilyLink(family, family.defaultLink());
        }
        Link link = Link.fromId(linkName);
        if (link == null || !family.links().contains(link)) {
            throw new FamilyLinkException(
                    "Link '" + linkName + "' is not a recognized link for family '" + family.id()
                            + "'; must be one of: " + family.links().stream().map(Link::id).toList(),
                    modelId,
                    null);
        }
        return new FamilyLink(family, link);
    }

    @Override
    public String toString() {
        return family.id() + "(" + link.id() + ")";
    }
}
