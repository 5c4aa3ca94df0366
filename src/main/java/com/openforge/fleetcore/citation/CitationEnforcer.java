package com.openforge.fleetcore.citation;

import com.openforge.fleetcore.search.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-processes a generated answer so it carries enough inline citations.
 *
 * Responsibilities:
 *   1. Repair  rewrite legacy markers ([[3]](url), [[3]], bare [3]) into the
 *              canonical "[3](url)" form; indices outside 1..sources are left
 *              as they are and reported
 *   2. Count   distinct in-range source indices cited
 *   3. Require min(max(ceil(0.4 × sources), 3 or 5 for technical answers), sources)
 *   4. Inject  when short, attach markers after factual statements (identifiers,
 *              ownership, quantities, build dates, type assertions), falling back
 *              to paragraph ends; uncited sources are used first
 *
 * Never throws on odd input. Zero sources means nothing is required and
 * nothing is injected.
 */
@Slf4j
@Component
public class CitationEnforcer {

    static final int    COVERAGE_PERCENT      = 40;
    static final int    FLOOR_DEFAULT         = 3;
    static final int    FLOOR_TECHNICAL       = 5;
    static final int    MAX_STATEMENT_TARGETS = 10;

    // ── Marker spellings ─────────────────────────────────────────────────────

    private static final Pattern DOUBLE_LINKED = Pattern.compile("\\[\\[(\\d+)\\]\\]\\(([^)\\s]*)\\)");
    private static final Pattern DOUBLE_BARE   = Pattern.compile("\\[\\[(\\d+)\\]\\](?!\\()");
    private static final Pattern CANONICAL     = Pattern.compile("(?<!\\[)\\[(\\d+)\\]\\(([^)\\s]+)\\)");
    private static final Pattern BARE          = Pattern.compile("(?<!\\[)\\[(\\d+)\\](?![(\\]])");

    /** Any marker spelling, with its link when present. */
    private static final Pattern ANY_MARKER = Pattern.compile("\\[\\[?(\\d+)\\]?\\](?:\\(([^)\\s]*)\\))?");

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    // ── Factual statement families ───────────────────────────────────────────

    private static final String CLAUSE_HEAD = "[^.!?\\n]*";
    private static final String CLAUSE_TAIL = "[^.!?\\n]*";

    private record StatementPattern(Pattern pattern, FactualStatement.Kind kind) {
        static StatementPattern of(String core, FactualStatement.Kind kind) {
            return new StatementPattern(Pattern.compile(CLAUSE_HEAD + core + CLAUSE_TAIL), kind);
        }
    }

    private static final List<StatementPattern> STATEMENT_PATTERNS = List.of(
            StatementPattern.of("\\b(?:(?i:IMO)\\s*:?\\s*\\d{7}|(?i:MMSI)\\s*:?\\s*\\d{9})\\b",
                    FactualStatement.Kind.IDENTIFIER),
            StatementPattern.of("\\b(?i:operated|owned|managed|chartered)\\s+(?i:by)\\s+[A-Z][A-Za-z&'-]*",
                    FactualStatement.Kind.OWNERSHIP),
            StatementPattern.of("\\b\\d+[,\\d]*\\.?\\d*\\s*(?i:meters?|metres?|tonnes?|tons|MW|kW|TEU|DWT|GT|knots?|years?|crew|passengers?)\\b",
                    FactualStatement.Kind.QUANTITY),
            StatementPattern.of("\\b(?i:delivered|built|commissioned|launched|registered)\\s+(?i:in|on)\\s+"
                            + "(?:(?i:January|February|March|April|May|June|July|August|September|October|November|December)\\s+)?\\d{4}\\b",
                    FactualStatement.Kind.BUILD_DATE),
            StatementPattern.of("\\b(?i:classified|type|class|category)\\s+(?i:as|is)\\s+(?i:a|an)\\s+[A-Z][a-z]+\\s+"
                            + "(?i:vessel|ship|carrier|tanker|bulk|container)\\b",
                    FactualStatement.Kind.CLASSIFICATION)
    );

    // ── Enforce ──────────────────────────────────────────────────────────────

    public CitationEnforcementResult enforce(String content, List<Source> sources, CitationOptions options) {
        String       original   = content == null ? "" : content;
        List<Source> srcs       = sources == null ? List.of() : sources;
        CitationOptions opts    = options == null ? CitationOptions.defaults() : options;

        int originalCount = countCitations(original, srcs.size());

        List<String> errors = new ArrayList<>();
        Repair repair = repair(original, srcs, errors);
        String working = repair.content();

        Set<Integer> cited = citedIndices(working, srcs.size());
        int found    = cited.size();
        int required = requiredCitations(srcs.size(), opts);

        int statementsFound = 0;
        int injected = 0;
        if (found < required && !working.isBlank()) {
            List<FactualStatement> statements = findFactualStatements(working);
            statementsFound = statements.size();
            Injection injection = inject(working, srcs, cited, required - found, statements);
            working  = injection.content();
            injected = injection.injected();
        }

        int finalCount = countCitations(working, srcs.size());
        boolean enforced = repair.repairs() > 0 || injected > 0;

        if (!errors.isEmpty()) {
            log.warn("[Citations] {} marker(s) point outside {} source(s): {}", errors.size(), srcs.size(), errors);
        }
        if (enforced) {
            log.info("[Citations] found={} required={} repaired={} injected={} final={}",
                    found, required, repair.repairs(), injected, finalCount);
        } else {
            log.debug("[Citations] found={} required={}, no changes", found, required);
        }

        return new CitationEnforcementResult(
                original,
                working,
                repair.repairs() + injected,
                found,
                required,
                enforced,
                new CitationEnforcementResult.Diagnostics(
                        originalCount, finalCount, required, statementsFound,
                        repair.repairs(), injected, errors));
    }

    /**
     * Minimum number of distinct sources an answer must cite.
     */
    static int requiredCitations(int sourceCount, CitationOptions options) {
        if (sourceCount <= 0) return 0;
        if (options.minRequired() != null) {
            return Math.max(0, Math.min(options.minRequired(), sourceCount));
        }
        int floor = options.technicalDepth() ? FLOOR_TECHNICAL : FLOOR_DEFAULT;
        int coverage = (sourceCount * COVERAGE_PERCENT + 99) / 100;
        int base  = Math.max(coverage, floor);
        return Math.min(base, sourceCount);
    }

    // ── Validate ─────────────────────────────────────────────────────────────

    public CitationValidation validate(String content, List<Source> sources) {
        String       text = content == null ? "" : content;
        List<Source> srcs = sources == null ? List.of() : sources;

        List<String> errors   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Matcher m = ANY_MARKER.matcher(text);
        while (m.find()) {
            int    index = parseIndex(m.group(1));
            String url   = m.group(2);
            if (!inRange(index, srcs.size())) {
                errors.add(outOfRange(index, srcs.size()));
                continue;
            }
            String expected = srcs.get(index - 1).urlOrEmpty();
            if (url != null && !url.isEmpty() && !url.equals(expected)) {
                warnings.add("Citation [%d] URL mismatch: expected %s, got %s".formatted(index, expected, url));
            }
        }
        return new CitationValidation(errors.isEmpty(), errors, warnings);
    }

    // ── Repair ───────────────────────────────────────────────────────────────

    private record Repair(String content, int repairs) {}

    private Repair repair(String content, List<Source> sources, List<String> errors) {
        int n = sources.size();
        int[] repairs = {0};

        String out = rewrite(content, DOUBLE_LINKED, m -> {
            int index = parseIndex(m.group(1));
            if (!inRange(index, n)) {
                errors.add(outOfRange(index, n));
                return m.group();
            }
            repairs[0]++;
            String url = m.group(2).isEmpty() ? sources.get(index - 1).urlOrEmpty() : m.group(2);
            return marker(index, url);
        });

        out = rewrite(out, DOUBLE_BARE, m -> {
            int index = parseIndex(m.group(1));
            if (!inRange(index, n)) {
                errors.add(outOfRange(index, n));
                return m.group();
            }
            repairs[0]++;
            return marker(index, sources.get(index - 1).urlOrEmpty());
        });

        Matcher canonical = CANONICAL.matcher(out);
        while (canonical.find()) {
            int index = parseIndex(canonical.group(1));
            if (!inRange(index, n)) errors.add(outOfRange(index, n));
        }

        out = rewrite(out, BARE, m -> {
            int index = parseIndex(m.group(1));
            if (!inRange(index, n)) {
                errors.add(outOfRange(index, n));
                return m.group();
            }
            repairs[0]++;
            return marker(index, sources.get(index - 1).urlOrEmpty());
        });

        return new Repair(out, repairs[0]);
    }

    private static String rewrite(String text, Pattern pattern, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // ── Factual statements ───────────────────────────────────────────────────

    /**
     * Finds up to ten citable statements, overlaps resolved in favour of the
     * longer span. Statements that already contain a marker are skipped.
     * Returned in priority order (see {@link FactualStatement.Kind}), then by position.
     */
    List<FactualStatement> findFactualStatements(String content) {
        String masked = maskMarkers(content);

        List<FactualStatement> candidates = new ArrayList<>();
        for (StatementPattern sp : STATEMENT_PATTERNS) {
            Matcher m = sp.pattern().matcher(masked);
            while (m.find()) {
                String raw = content.substring(m.start(), m.end());
                String text = raw.stripTrailing();
                int    lead = text.length() - text.stripLeading().length();
                text = text.strip();
                if (text.isEmpty()) continue;
                if (!masked.substring(m.start(), m.end()).equals(raw)) continue;
                candidates.add(new FactualStatement(text, m.start() + lead, sp.kind()));
            }
        }

        return deduplicate(candidates).stream()
                .sorted(Comparator.comparing(FactualStatement::kind)
                        .thenComparingInt(FactualStatement::start))
                .limit(MAX_STATEMENT_TARGETS)
                .toList();
    }

    static List<FactualStatement> deduplicate(List<FactualStatement> statements) {
        List<FactualStatement> sorted = new ArrayList<>(statements);
        sorted.sort(Comparator.comparingInt(FactualStatement::start));

        List<FactualStatement> result = new ArrayList<>();
        for (FactualStatement s : sorted) {
            if (result.isEmpty() || !result.get(result.size() - 1).overlaps(s)) {
                result.add(s);
            } else if (s.text().length() > result.get(result.size() - 1).text().length()) {
                result.set(result.size() - 1, s);
            }
        }
        return result;
    }

    /** Blanks out every marker so sentence patterns do not run into link URLs. */
    private static String maskMarkers(String content) {
        StringBuilder sb = new StringBuilder(content);
        Matcher m = ANY_MARKER.matcher(content);
        while (m.find()) {
            for (int i = m.start(); i < m.end(); i++) sb.setCharAt(i, ' ');
        }
        return sb.toString();
    }

    // ── Injection ────────────────────────────────────────────────────────────

    private record Injection(String content, int injected) {}

    private Injection inject(String content, List<Source> sources, Set<Integer> cited,
                             int needed, List<FactualStatement> statements) {
        List<Integer> insertAt = new ArrayList<>();
        statements.stream()
                .limit(needed)
                .map(FactualStatement::end)
                .sorted()
                .forEach(insertAt::add);

        if (insertAt.size() < needed) {
            List<Integer> paragraphEnds = paragraphEnds(content);
            if (statements.isEmpty()) {
                log.debug("[Citations] No factual statements, falling back to paragraph ends");
            }
            for (int end : paragraphEnds) {
                if (insertAt.size() >= needed) break;
                if (!insertAt.contains(end)) insertAt.add(end);
            }
            int last = paragraphEnds.isEmpty() ? content.stripTrailing().length()
                                               : paragraphEnds.get(paragraphEnds.size() - 1);
            while (insertAt.size() < needed) insertAt.add(last);
        }
        insertAt.sort(Comparator.naturalOrder());

        SourcePicker picker = new SourcePicker(sources.size(), cited);
        Map<Integer, StringBuilder> byPosition = new TreeMap<>(Comparator.reverseOrder());
        for (int position : insertAt) {
            int index = picker.next();
            byPosition.computeIfAbsent(position, p -> new StringBuilder())
                    .append(' ').append(marker(index, sources.get(index - 1).urlOrEmpty()));
        }

        StringBuilder sb = new StringBuilder(content);
        byPosition.forEach((position, markers) -> sb.insert(position.intValue(), markers));
        return new Injection(sb.toString(), insertAt.size());
    }

    /** Offsets just past the last non-whitespace character of each non-blank paragraph. */
    private static List<Integer> paragraphEnds(String content) {
        List<Integer> ends = new ArrayList<>();
        Matcher m = PARAGRAPH_BREAK.matcher(content);
        int from = 0;
        while (m.find()) {
            addParagraphEnd(content, from, m.start(), ends);
            from = m.end();
        }
        addParagraphEnd(content, from, content.length(), ends);
        return ends;
    }

    private static void addParagraphEnd(String content, int from, int to, List<Integer> ends) {
        String paragraph = content.substring(from, to);
        if (paragraph.isBlank()) return;
        ends.add(from + paragraph.stripTrailing().length());
    }

    /** Uncited source indices first, ascending, then round-robin over all of them. */
    private static final class SourcePicker {
        private final int           sourceCount;
        private final List<Integer> uncited = new ArrayList<>();
        private int next;
        private int cycle;

        SourcePicker(int sourceCount, Set<Integer> cited) {
            this.sourceCount = sourceCount;
            for (int i = 1; i <= sourceCount; i++) {
                if (!cited.contains(i)) uncited.add(i);
            }
        }

        int next() {
            if (next < uncited.size()) return uncited.get(next++);
            return (cycle++ % sourceCount) + 1;
        }
    }

    // ── Counting ─────────────────────────────────────────────────────────────

    /** Distinct in-range source indices cited by any marker spelling. */
    static int countCitations(String content, int sourceCount) {
        return citedIndices(content, sourceCount).size();
    }

    private static Set<Integer> citedIndices(String content, int sourceCount) {
        Set<Integer> indices = new LinkedHashSet<>();
        Matcher m = ANY_MARKER.matcher(content);
        while (m.find()) {
            int index = parseIndex(m.group(1));
            if (inRange(index, sourceCount)) indices.add(index);
        }
        return indices;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String marker(int index, String url) {
        return "[" + index + "](" + url + ")";
    }

    private static boolean inRange(int index, int sourceCount) {
        return index >= 1 && index <= sourceCount;
    }

    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String outOfRange(int index, int sourceCount) {
        return "Citation [%d] references source %d, but only %d sources available"
                .formatted(index, index, sourceCount);
    }
}
