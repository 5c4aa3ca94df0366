package com.openforge.fleetcore.research;

import com.openforge.fleetcore.search.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Works out which facts of a vessel profile are still missing and what to
 * search for next.
 *
 * Evidence is the draft answer plus the content of every source gathered so
 * far. Nine fields are tracked. Most count as present when their label appears
 * with something other than a placeholder ("Not found", "N/A", "Not available",
 * "Unknown") after it. Owner and operator are stricter: they need a
 * capitalized company name attached, as in "Owner: Maersk Line" or
 * "managed by V.Ships".
 *
 * Completeness is measured against a 20-field profile, so a single gap never
 * costs more than five points.
 */
@Slf4j
@Component
public class ResearchGapAnalyzer {

    static final int EXPECTED_PROFILE_FIELDS   = 20;
    static final int COMPLETENESS_TARGET       = 80;
    static final int HIGH_GAPS_FORCING_RESEARCH = 2;
    static final int LAST_LOW_PRIORITY_ITERATION = 2;

    private static final String COMPANY_NAME = "([A-Z][A-Za-z0-9&'.-]*(?:\\s+[A-Z&][A-Za-z0-9&'.-]*)*)";
    private static final String LABEL_SEPARATOR = "\\**\\s*[:\\-]\\s*\\**\\s*";

    private static final Pattern PLACEHOLDER_AFTER_TERM = Pattern.compile(
            "^[^\\n:.]{0,30}?\\**\\s*[:\\-]?\\s*\\**\\s*(?:not found|n/a|not available|unknown)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLACEHOLDER_VALUE = Pattern.compile(
            "^(?:not\\b|n/a\\b|unknown\\b|none\\b|tbd\\b)", Pattern.CASE_INSENSITIVE);

    /** One tracked profile field. */
    private record FieldRule(
            String        field,
            GapImportance importance,
            List<Pattern> evidence,
            boolean       strict,
            String        queryTemplate,
            List<String>  targetSites,
            IntPredicate  activeInIteration
    ) {
        ResearchGap toGap(String entityName) {
            return new ResearchGap(field, importance, queryTemplate.replace("{entity}", entityName), targetSites);
        }
    }

    private static final List<FieldRule> FIELDS = List.of(
            generic("IMO Number", GapImportance.CRITICAL, List.of("IMO"),
                    "\"{entity}\" IMO number site:marinetraffic.com OR site:vesselfinder.com OR site:shipspotting.com",
                    List.of("marinetraffic.com", "vesselfinder.com", "shipspotting.com", "equasis.org")),
            generic("MMSI", GapImportance.CRITICAL, List.of("MMSI"),
                    "\"{entity}\" MMSI site:marinetraffic.com OR site:vesselfinder.com",
                    List.of("marinetraffic.com", "vesselfinder.com")),
            strict("Registered Owner", GapImportance.HIGH,
                    "Registered Owner|Beneficial Owner|Owner", "owned",
                    "\"{entity}\" vessel owner company site:equasis.org OR site:lrsearch.lr.org OR site:dnv.com",
                    List.of("equasis.org", "lr.org", "dnv.com", "abs.org", "marinetraffic.com")),
            strict("Operator/Manager", GapImportance.HIGH,
                    "Technical Manager|Commercial Manager|Operator|Manager|Management", "operated|managed",
                    "\"{entity}\" ship management operator technical manager",
                    List.of("equasis.org", "maritime-executive.com", "marinetraffic.com")),
            generic("Gross Tonnage", GapImportance.MEDIUM, List.of("Gross Tonnage", "GT", "GRT"),
                    "\"{entity}\" specifications tonnage GT DWT",
                    List.of("marinetraffic.com", "vesselfinder.com", "equasis.org")),
            generic("Length Overall", GapImportance.MEDIUM, List.of("Length", "LOA"),
                    "\"{entity}\" length LOA beam draft specifications",
                    List.of("marinetraffic.com", "vesselfinder.com")),
            generic("Call Sign", GapImportance.MEDIUM, List.of("Call Sign", "Callsign"),
                    "\"{entity}\" call sign radio",
                    List.of("marinetraffic.com", "vesselfinder.com")),
            early(generic("Shipyard & Build Year", GapImportance.LOW, List.of("Shipyard", "Builder", "Built"),
                    "\"{entity}\" shipyard built delivery date",
                    List.of("shipspotting.com", "gcaptain.com", "marinetraffic.com"))),
            early(generic("Classification Society", GapImportance.LOW,
                    List.of("Class Society", "Classification Society", "Classification"),
                    "\"{entity}\" class society classification DNV LR ABS BV",
                    List.of("equasis.org", "dnv.com", "lr.org", "abs.org")))
    );

    // ── Analyze ──────────────────────────────────────────────────────────────

    /**
     * @param draftContent    answer text produced so far, may be empty
     * @param entityName      vessel being profiled, quoted into generated queries
     * @param existingSources sources gathered so far; their content counts as evidence
     * @param iteration       1-based research iteration
     */
    public GapAnalysis analyze(String draftContent, String entityName,
                               List<Source> existingSources, int iteration) {
        String evidence = evidence(draftContent, existingSources);
        String name = entityName == null || entityName.isBlank() ? "vessel" : entityName.trim();

        List<ResearchGap> gaps = new ArrayList<>();
        for (FieldRule rule : FIELDS) {
            if (!rule.activeInIteration().test(iteration)) continue;
            boolean missing = rule.strict()
                    ? !hasAttributedCompany(evidence, rule.evidence())
                    : !hasValue(evidence, rule.evidence());
            if (missing) gaps.add(rule.toGap(name));
        }

        int completeness = Math.max(0, (int) Math.round(
                (EXPECTED_PROFILE_FIELDS - gaps.size()) / (double) EXPECTED_PROFILE_FIELDS * 100));
        long critical = gaps.stream().filter(g -> g.importance() == GapImportance.CRITICAL).count();
        long high     = gaps.stream().filter(g -> g.importance() == GapImportance.HIGH).count();
        boolean needsMore = completeness < COMPLETENESS_TARGET
                || critical > 0
                || high >= HIGH_GAPS_FORCING_RESEARCH;

        if (!gaps.isEmpty()) {
            log.debug("[Gaps] '{}' iteration {}: missing {}", name, iteration,
                    gaps.stream().map(ResearchGap::field).collect(Collectors.joining(", ")));
        }
        return new GapAnalysis(gaps, completeness, needsMore, iteration);
    }

    // ── Field tests ──────────────────────────────────────────────────────────

    /** True when at least one occurrence of a term is not followed by a placeholder. */
    static boolean hasValue(String evidence, List<Pattern> terms) {
        for (Pattern term : terms) {
            Matcher m = term.matcher(evidence);
            while (m.find()) {
                String after = evidence.substring(m.end(), Math.min(evidence.length(), m.end() + 60));
                if (!PLACEHOLDER_AFTER_TERM.matcher(after).find()) return true;
            }
        }
        return false;
    }

    /** True when a label or verb construction carries a real company name. */
    static boolean hasAttributedCompany(String evidence, List<Pattern> constructions) {
        for (Pattern construction : constructions) {
            Matcher m = construction.matcher(evidence);
            while (m.find()) {
                String value = evidence.substring(m.start(1));
                if (!PLACEHOLDER_VALUE.matcher(value).find()) return true;
            }
        }
        return false;
    }

    private static String evidence(String draftContent, List<Source> sources) {
        StringBuilder sb = new StringBuilder(draftContent == null ? "" : draftContent);
        if (sources != null) {
            for (Source source : sources) {
                if (source != null) sb.append("\n\n").append(source.contentOrEmpty());
            }
        }
        return sb.toString();
    }

    // ── Rule construction ────────────────────────────────────────────────────

    private static FieldRule generic(String field, GapImportance importance, List<String> terms,
                                     String query, List<String> sites) {
        List<Pattern> patterns = terms.stream()
                .map(t -> Pattern.compile("\\b" + Pattern.quote(t) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList();
        return new FieldRule(field, importance, patterns, false, query, sites, i -> true);
    }

    private static FieldRule strict(String field, GapImportance importance, String labels, String verbs,
                                    String query, List<String> sites) {
        List<Pattern> patterns = List.of(
                Pattern.compile("\\b(?i:" + labels + ")" + LABEL_SEPARATOR + COMPANY_NAME),
                Pattern.compile("\\b(?i:" + verbs + ")\\s+(?i:by)\\s+" + COMPANY_NAME));
        return new FieldRule(field, importance, patterns, true, query, sites, i -> true);
    }

    private static FieldRule early(FieldRule rule) {
        return new FieldRule(rule.field(), rule.importance(), rule.evidence(), rule.strict(),
                rule.queryTemplate(), rule.targetSites(), i -> i <= LAST_LOW_PRIORITY_ITERATION);
    }
}
