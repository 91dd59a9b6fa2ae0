package io.segreg.core.engine;

import io.segreg.core.error.DuplicateTermException;
import io.segreg.core.error.FamilyLinkException;
import io.segreg.core.error.FormulaParseException;
import io.segreg.core.model.Channel;
import io.segreg.core.model.ChannelResolution;
import io.segreg.core.model.Family;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.Parameter;
import io.segreg.core.model.ParameterKind;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.ResolvedTerm;
import io.segreg.core.model.Segment;
import io.segreg.core.model.Term;
import io.segreg.core.model.VaryingEffect;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assigns canonical parameter names and resolves carry-over for every channel of every
 * segment.
 *
 * <p>
 * Each channel (mean, sigma, one per AR order) is walked segment by segment:
 * <ul>
 * <li>{@code 1} creates a new intercept and resets the level</li>
 * <li>{@code rel(1)} creates an offset on the carried intercept and resets the level</li>
 * <li>{@code 0} or an omitted intercept joins the previous segment continuously; in the
 * segment that first declares a channel an omitted intercept is an implicit {@code 1}</li>
 * <li>omitted slopes keep their previous parameters</li>
 * <li>a channel not mentioned at all keeps its whole previous resolution</li>
 * </ul>
 *
 * <p>
 * Thread-safe: instances hold only the model id used for error reporting.
 */
public final class ParameterTableBuilder {

    private final String modelId;

    public ParameterTableBuilder(String modelId) {
        this.modelId = modelId;
    }

    /**
     * Builds the parameter table.
     *
     * @param segments   parsed segments in order
     * @param familyLink validated family/link pair
     * @param predictor  the predictor name, used for term codes
     * @return the immutable table
     * @throws DuplicateTermException if a segment repeats a term
     * @throws FamilyLinkException    if a sub-model or trials column does not fit the family
     * @throws FormulaParseException  if a relative term has nothing to be relative to
     */
    public ParameterTable build(List<Segment> segments, FamilyLink familyLink, String predictor) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(familyLink, "familyLink must not be null");
        Objects.requireNonNull(predictor, "predictor must not be null");
        validateFamily(segments, familyLink);

        List<Map<Channel, List<Term>>> declared = new ArrayList<>();
        TreeSet<Channel> channels = new TreeSet<>();
        channels.add(Channel.MEAN);
        for (Segment segment : segments) {
            Map<Channel, List<Term>> perSegment = declaredChannels(segment, familyLink);
            channels.addAll(perSegment.keySet());
            declared.add(perSegment);
        }

        List<List<Parameter>> segmentParameters = new ArrayList<>();
        for (int k = 0; k < segments.size(); k++) {
            segmentParameters.add(new ArrayList<>());
        }
        Map<Channel, List<ChannelResolution>> resolutions = new LinkedHashMap<>();
        for (Channel channel : channels) {
            ChannelResolution previous = null;
            List<ChannelResolution> chain = new ArrayList<>();
            for (Segment segment : segments) {
                List<Term> terms = declared.get(segment.index() - 1).get(channel);
                ChannelResolution current = terms == null
                        ? carry(channel, segment.index(), previous)
                        : resolve(channel, segment.index(), terms, previous, predictor,
                                segmentParameters.get(segment.index() - 1));
                chain.add(current);
                previous = current;
            }
            resolutions.put(channel, chain);
        }

        List<Parameter> parameters = new ArrayList<>();
        for (int k = 1; k < segments.size(); k++) {
            parameters.add(new Parameter(
                    ParameterTable.changePoint(k), ParameterKind.CHANGE_POINT, k, null, 0, false, null));
        }
        // channels were walked in canonical order, so each segment's list is already mean, sigma, ar1, ...
        segmentParameters.forEach(parameters::addAll);

        List<VaryingEffect> varyingEffects = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.varyingGroups().isEmpty()) {
                continue;
            }
            if (segment.varyingGroups().size() > 1) {
                Term.VaryingGroup second = segment.varyingGroups().get(1);
                throw new DuplicateTermException(
                        "Change point " + (segment.index() - 1) + " has more than one varying effect ("
                                + segment.varyingGroups().stream().map(Term.VaryingGroup::group).toList()
                                + "); at most one grouping per change point is supported",
                        modelId,
                        segment.index(),
                        "(1 | " + second.group() + ")");
            }
            int k = segment.index() - 1;
            String group = segment.varyingGroups().get(0).group();
            String spread = ParameterTable.changePoint(k) + "_sd";
            String offset = ParameterTable.changePoint(k) + "_" + group;
            parameters.add(new Parameter(spread, ParameterKind.CHANGE_POINT_SPREAD, k, null, 0, false, group));
            parameters.add(new Parameter(offset, ParameterKind.VARYING_OFFSET, k, null, 0, false, group));
            varyingEffects.add(new VaryingEffect(k, group, offset, spread));
        }

        try {
            return new ParameterTable(parameters, resolutions, varyingEffects, segments.size());
        } catch (IllegalArgumentException e) {
            // e.g. a grouping variable named like a term code: cp_1_sd vs. (1 | sd)
            throw new DuplicateTermException(e.getMessage(), modelId, null, null);
        }
    }

    private void validateFamily(List<Segment> segments, FamilyLink familyLink) {
        for (Segment segment : segments) {
            if (!familyLink.family().hasSigma()) {
                if (!segment.variance().isEmpty()) {
                    throw new FamilyLinkException(
                            "sigma() in segment " + segment.index() + " requires the gaussian family, not "
                                    + familyLink.family().id(),
                            modelId,
                            segment.index());
                }
                if (!segment.autoregressive().isEmpty()) {
                    throw new FamilyLinkException(
                            "ar() in segment " + segment.index() + " requires the gaussian family, not "
                                    + familyLink.family().id(),
                            modelId,
                            segment.index());
                }
            }
        }
        Segment first = segments.get(0);
        boolean binomial = familyLink.family() == Family.BINOMIAL;
        if (binomial && first.trials() == null) {
            throw new FamilyLinkException(
                    "The binomial family needs the number of trials: write '" + first.response()
                            + " | trials(N) ~ ...'",
                    modelId,
                    1);
        }
        if (!binomial && first.trials() != null) {
            throw new FamilyLinkException(
                    "trials(" + first.trials() + ") is only valid for the binomial family, not "
                            + familyLink.family().id(),
                    modelId,
                    1);
        }
    }

    /** The terms each channel declares in one segment; absent channels are not mentioned. */
    private Map<Channel, List<Term>> declaredChannels(Segment segment, FamilyLink familyLink) {
        Map<Channel, List<Term>> result = new TreeMap<>();
        List<Term> mean = new ArrayList<>();
        for (Term term : segment.terms()) {
            if (term instanceof Term.Intercept || term instanceof Term.Slope) {
                mean.add(term);
            }
        }
        result.put(Channel.MEAN, mean);

        List<Term.Variance> variance = segment.variance();
        if (variance.size() > 1) {
            throw new DuplicateTermException(
                    "Segment " + segment.index() + " has more than one sigma() term", modelId, segment.index(), "sigma");
        }
        if (!variance.isEmpty()) {
            result.put(Channel.SIGMA, variance.get(0).formula());
        } else if (segment.index() == 1 && familyLink.family().hasSigma()) {
            result.put(Channel.SIGMA, List.of(new Term.Intercept(Term.InterceptMode.ABSOLUTE, -1)));
        }

        List<Term.Autoregressive> ar = segment.autoregressive();
        if (ar.size() > 1) {
            throw new DuplicateTermException(
                    "Segment " + segment.index() + " has more than one ar() term", modelId, segment.index(), "ar");
        }
        if (!ar.isEmpty()) {
            Term.Autoregressive spec = ar.get(0);
            List<Term> formula = spec.formula().isEmpty()
                    ? List.of(new Term.Intercept(Term.InterceptMode.ABSOLUTE, spec.position()))
                    : spec.formula();
            for (int n = 1; n <= spec.order(); n++) {
                result.put(Channel.ar(n), formula);
            }
        }
        return result;
    }

    private static ChannelResolution carry(Channel channel, int segment, ChannelResolution previous) {
        if (previous == null) {
            return new ChannelResolution(channel, segment, false, segment, Map.of());
        }
        return new ChannelResolution(channel, segment, previous.started(), previous.anchor(), previous.terms());
    }

    private ChannelResolution resolve(
            Channel channel,
            int k,
            List<Term> terms,
            ChannelResolution previous,
            String predictor,
            List<Parameter> created) {
        boolean firstDeclaration = previous == null || !previous.started();
        Map<String, ResolvedTerm> carried = firstDeclaration ? Map.of() : previous.terms();

        Term.Intercept intercept = null;
        for (Term term : terms) {
            if (term instanceof Term.Intercept candidate) {
                if (intercept != null) {
                    throw new DuplicateTermException(
                            "Segment " + k + " specifies the " + channel + " intercept more than once",
                            modelId,
                            k,
                            channel.termKey(ChannelResolution.INTERCEPT_KEY));
                }
                intercept = candidate;
            }
        }
        Term.InterceptMode mode = intercept != null
                ? intercept.mode()
                : (firstDeclaration ? Term.InterceptMode.ABSOLUTE : null);

        Map<String, ResolvedTerm> resolved = new LinkedHashMap<>();
        int anchor = firstDeclaration ? k : previous.anchor();
        ResolvedTerm carriedIntercept = carried.get(ChannelResolution.INTERCEPT_KEY);
        if (mode == Term.InterceptMode.ABSOLUTE) {
            String name = channel.interceptName(k);
            created.add(new Parameter(
                    name, ParameterKind.interceptOf(channel), k, ChannelResolution.INTERCEPT_KEY,
                    channel.order(), false, null));
            resolved.put(ChannelResolution.INTERCEPT_KEY,
                    new ResolvedTerm(ChannelResolution.INTERCEPT_KEY, null, List.of(name), k));
            anchor = k;
        } else if (mode == Term.InterceptMode.RELATIVE) {
            if (carriedIntercept == null) {
                throw new FormulaParseException(
                        "rel(1) in segment " + k + " has no earlier " + channel + " intercept to be relative to",
                        modelId,
                        k,
                        intercept.position());
            }
            String name = channel.interceptName(k);
            created.add(new Parameter(
                    name, ParameterKind.interceptOf(channel), k, ChannelResolution.INTERCEPT_KEY,
                    channel.order(), true, null));
            List<String> summands = new ArrayList<>(carriedIntercept.summands());
            summands.add(name);
            resolved.put(ChannelResolution.INTERCEPT_KEY,
                    new ResolvedTerm(ChannelResolution.INTERCEPT_KEY, null, summands, k));
            anchor = k;
        } else if (carriedIntercept != null) {
            resolved.put(ChannelResolution.INTERCEPT_KEY, carriedIntercept);
        }

        // carried slopes first, in their original order; redefinitions replace in place
        for (ResolvedTerm term : carried.values()) {
            if (!term.isIntercept()) {
                resolved.put(term.key(), term);
            }
        }
        List<String> seen = new ArrayList<>();
        for (Term term : terms) {
            if (!(term instanceof Term.Slope slope)) {
                continue;
            }
            String code = TermNames.code(slope.expression(), predictor);
            if (seen.contains(code)) {
                throw new DuplicateTermException(
                        "Segment " + k + " specifies the " + channel + " term '" + slope.expression().render()
                                + "' more than once",
                        modelId,
                        k,
                        channel.termKey(code));
            }
            seen.add(code);
            String name = channel.slopeName(code, k);
            List<String> summands = new ArrayList<>();
            if (slope.relative()) {
                ResolvedTerm base = carried.get(code);
                if (base == null) {
                    throw new FormulaParseException(
                            "rel(" + slope.expression().render() + ") in segment " + k + " has no earlier "
                                    + channel + " slope to be relative to",
                            modelId,
                            k,
                            slope.position());
                }
                summands.addAll(base.summands());
            }
            summands.add(name);
            created.add(new Parameter(
                    name, ParameterKind.slopeOf(channel), k, code, channel.order(), slope.relative(), null));
            resolved.put(code, new ResolvedTerm(code, slope.expression(), summands, k));
        }
        return new ChannelResolution(channel, k, true, anchor, resolved);
    }
}
