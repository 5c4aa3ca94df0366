package com.openforge.fleetcore.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based recognition of vessels and companies in free text.
 *
 * Vessel candidates come from three sources, strongest first:
 * <ol>
 *   <li>a ship prefix: "MV Ever Given", "MT Stena Bulk"</li>
 *   <li>an explicit noun: "vessel Dynamic 17", "ship Norvind"</li>
 *   <li>a capitalized word followed by a number ("Dynamic 17"), accepted only
 *       when the surrounding text carries an IMO number or a vessel type</li>
 * </ol>
 * Companies are capitalized names ending in a trade suffix
 * (Marine, Shipping, Lines, Group, Services, Maritime).
 */
@Component
public class MaritimeEntityExtractor {

    // Name words stay on one line and stop before an identifier label or a long number.
    private static final String NAME_TAIL =
            "(?:[ \\t]+(?!(?:IMO|MMSI)\\b)(?!\\d{5,}\\b)[A-Z0-9][A-Za-z0-9-]*)*";

    private static final Pattern PREFIXED_VESSEL = Pattern.compile(
            "\\b(?:MV|MS|MT|SS|HMS)[ \\t]+([A-Z][A-Za-z0-9-]*" + NAME_TAIL + ")");
    private static final Pattern NAMED_VESSEL = Pattern.compile(
            "\\b(?:[Vv]essel|[Ss]hip)[ \\t]+([A-Z][A-Za-z0-9-]*" + NAME_TAIL + ")");
    private static final Pattern NUMBERED_NAME = Pattern.compile(
            "\\b([A-Z][a-z]+\\s+\\d{1,4})\\b");
    private static final Pattern COMPANY = Pattern.compile(
            "\\b((?:[A-Z][a-z]+\\s+)+(?:Marine|Shipping|Lines|Group|Services|Maritime))\\b");

    private static final Pattern IMO = Pattern.compile("\\bIMO[:\\s#]+(\\d{7})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VESSEL_TYPE = Pattern.compile(
            "\\b(container ship|tanker|bulk carrier|crew boat|supply vessel|high-speed craft|offshore vessel"
                    + "|cargo ship|research vessel|fishing vessel|tug|ferry|dredger)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OPERATOR = Pattern.compile(
            "(?:(?i:operated|owned|managed|chartered)\\s+(?i:by|under)|(?i:operator|owner|manager)\\s*:)\\s*"
                    + "([A-Z][A-Za-z&'-]*(?:\\s+[A-Z&][A-Za-z&'-]*)*)");
    private static final Pattern BUILT_YEAR = Pattern.compile(
            "\\b(?i:built|delivered|launched)\\b[^.!?]*?\\b((?:19|20)\\d{2})\\b");
    private static final Pattern FLAG = Pattern.compile(
            "\\b(?i:flag(?:ged)?|registered)\\b[^.!?]*?\\b(?:in|of|:)\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)");

    private static final Set<String> MONTHS = Set.of(
            "January", "February", "March", "April", "May", "June", "July",
            "August", "September", "October", "November", "December");
    private static final Set<String> STOP_WORDS = Set.of(
            "Is", "Was", "Has", "The", "And", "With", "For", "In", "Of", "IMO", "MMSI");

    /** Vessel names found in {@code text}, in order of first appearance. */
    public List<String> extractVesselNames(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        collect(PREFIXED_VESSEL, text, names);
        collect(NAMED_VESSEL, text, names);
        if (IMO.matcher(text).find() || VESSEL_TYPE.matcher(text).find()) {
            Matcher m = NUMBERED_NAME.matcher(text);
            while (m.find()) {
                String candidate = m.group(1);
                if (!MONTHS.contains(candidate.split("\\s+")[0])) {
                    names.add(candidate);
                }
            }
        }
        return new ArrayList<>(names);
    }

    /** Company names found in {@code text}, in order of first appearance. */
    public List<String> extractCompanyNames(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        collect(COMPANY, text, names);
        return new ArrayList<>(names);
    }

    /** True when the text names a vessel or a company this extractor can recognize. */
    public boolean mentionsEntity(String text) {
        return !extractVesselNames(text).isEmpty() || !extractCompanyNames(text).isEmpty();
    }

    /**
     * Builds a vessel entry from the sentences of {@code text} that mention
     * {@code name}: IMO number, vessel type, operator, build year and flag.
     */
    public VesselEntity describeVessel(String name, String text, int messageIndex) {
        String focus = sentencesMentioning(name, text);
        Map<String, String> specs = new LinkedHashMap<>();
        firstGroup(BUILT_YEAR, focus).ifPresent(year -> specs.put("year", year));
        firstGroup(FLAG, focus).ifPresent(flag -> specs.put("flag", flag));

        return VesselEntity.builder()
                .name(name)
                .imo(firstGroup(IMO, focus).orElse(null))
                .vesselType(firstGroup(VESSEL_TYPE, focus).map(String::toLowerCase).orElse(null))
                .operator(firstGroup(OPERATOR, focus).map(String::trim).orElse(null))
                .specs(specs)
                .firstMentioned(messageIndex)
                .build();
    }

    public CompanyEntity describeCompany(String name, String text, int messageIndex) {
        String snippet = sentencesMentioning(name, text);
        if (snippet.length() > 300) snippet = snippet.substring(0, 300);
        return new CompanyEntity(name, snippet, messageIndex);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void collect(Pattern pattern, String text, Set<String> into) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String name = trimTrailingStopWords(m.group(1).trim());
            if (!name.isEmpty()) into.add(name);
        }
    }

    private static String trimTrailingStopWords(String name) {
        String[] words = name.split("\\s+");
        int end = words.length;
        while (end > 1 && STOP_WORDS.contains(words[end - 1])) end--;
        return String.join(" ", Arrays.copyOf(words, end));
    }

    /** Up to two sentences containing {@code name}; the whole text if none do. */
    static String sentencesMentioning(String name, String text) {
        if (text == null) return "";
        Matcher m = Pattern.compile("[^.!?\\n]*" + Pattern.quote(name) + "[^.!?\\n]*[.!?]?").matcher(text);
        StringBuilder sb = new StringBuilder();
        int found = 0;
        while (m.find() && found < 2) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(m.group().trim());
            found++;
        }
        return found == 0 ? text : sb.toString();
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
