package com.openforge.fleetcore.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fixed keyword tables and pattern families used to classify queries.
 *
 * All tables are immutable and compiled once at class load.
 */
final class ClassificationVocabulary {

    private ClassificationVocabulary() {}

    // ── Platform vocabulary ──────────────────────────────────────────────────

    static final List<String> PLATFORM_KEYWORDS = List.of(
            // brand
            "fleetcore", "seacore", "fleet core", "sea core",
            // system / management
            "system", "systems", "management", "manager",
            "organization", "organisation", "organizational", "organisational",
            // maintenance
            "pms", "planned maintenance system", "planned maintenance",
            "work order", "work orders", "maintenance scheduling",
            "job card", "job cards", "maintenance schedule", "maintenance tasks",
            "maintenance management", "maintenance system",
            // inventory & procurement
            "inventory management", "spare parts management", "procurement", "purchasing system",
            "parts management", "stock management", "inventory system", "parts tracking",
            // crew
            "crew management", "crew scheduling", "crew roster", "personnel management",
            "staff scheduling", "crew system", "personnel system",
            // compliance & safety
            "compliance tracking", "compliance management", "safety management system", "sms system",
            "audit trail", "regulatory compliance", "certificate tracking", "certification management",
            "compliance system", "safety system",
            // finance
            "budget tracking", "cost management", "financial management", "expense tracking",
            "budget system", "financial system",
            // documentation
            "document management", "digital documentation", "paperless", "digital twin",
            "document system", "documentation system",
            // ui
            "dashboard", "analytics", "reporting", "reports", "user interface", "ui", "ux",
            "how to use", "tutorial", "guide", "navigation", "menu",
            // account
            "login", "account", "subscription", "pricing", "user account", "authentication",
            "access control", "permissions",
            // capabilities
            "features", "capabilities", "integrations", "mobile app", "offline mode", "sync",
            "real-time", "notifications", "alerts", "functionality", "modules",
            // technical platform
            "api", "integration", "data export", "architecture", "database",
            "implementation", "deployment",
            // workflow
            "workflow", "process", "automation", "task management", "scheduling",
            "approval process", "review process",
            // data
            "data management", "data visualization", "business intelligence", "kpi",
            "performance metrics", "reporting system");

    /** Single-word platform keywords, matched on word boundaries. */
    private static final List<Pattern> PLATFORM_WORD_PATTERNS = PLATFORM_KEYWORDS.stream()
            .filter(k -> !k.contains(" "))
            .map(ClassificationVocabulary::wordPattern)
            .toList();

    /** Multi-word platform phrases, matched as lowercase substrings. */
    private static final List<String> PLATFORM_PHRASES = PLATFORM_KEYWORDS.stream()
            .filter(k -> k.contains(" "))
            .toList();

    // ── Entity vocabulary ────────────────────────────────────────────────────

    static final List<String> ENTITY_KEYWORDS = List.of(
            "vessel", "ship", "fleet",
            "company", "operator", "owner",
            "equipment", "manufacturer", "oem",
            "imo", "mmsi", "flag",
            "port", "shipyard", "classification society");

    private static final List<Pattern> ENTITY_PATTERNS = ENTITY_KEYWORDS.stream()
            .map(ClassificationVocabulary::wordPattern)
            .toList();

    static final Pattern VESSEL_PREFIX = Pattern.compile("\\b(?i:MV|MS|MT|SS|HMS)\\s+[A-Z]");
    static final Pattern IDENTIFIER    = Pattern.compile("\\b(IMO|MMSI)[\\s:]?\\d+", Pattern.CASE_INSENSITIVE);

    // ── Knowledge-mode pattern families ──────────────────────────────────────

    static final List<Pattern> SYSTEM_ORGANIZATION = compileAll(
            "\\b(system|systems)\\s+(organization|organisation|structure|management)",
            "\\b(organizational|organisational)\\s+(structure|management)",
            "\\bhow\\s+(is|are)\\s+.*(organized|organised|structured)",
            "\\bwhat\\s+(is|are)\\s+the\\s+(organization|organisation|structure)",
            "\\bmanagement\\s+(structure|hierarchy|system)",
            "\\bhierarchy\\s+of\\s+systems?");

    static final List<Pattern> HOW_TO = compileAll(
            "\\bhow\\s+(do|can|to|does)\\s+(i|we|you|users?)\\b",
            "\\bwhat\\s+is\\s+the\\s+(process|workflow|procedure)\\b",
            "\\bhow\\s+to\\s+",
            "\\bsteps?\\s+to\\b",
            "\\bguide\\s+(for|to|on)\\b");

    // ── Technical depth ──────────────────────────────────────────────────────

    /** Maintenance and machinery vocabulary; 2 points per distinct term. */
    static final List<Pattern> TECHNICAL_TERMS = compileAll(
            "\\bengines?\\b", "\\bpropulsion\\b", "\\bmaintenance\\b", "\\boverhaul(s|ed|ing)?\\b",
            "\\bspecifications?\\b", "\\bspecs\\b", "\\bauxiliar(y|ies)\\b", "\\bgenerators?\\b",
            "\\bgearbox(es)?\\b", "\\bpropellers?\\b", "\\bturbochargers?\\b", "\\bpumps?\\b",
            "\\bcompressors?\\b", "\\bboilers?\\b", "\\bthrusters?\\b", "\\bcrankshaft\\b",
            "\\bcylinders?\\b", "\\bfuel (system|injection|consumption)\\b", "\\blube oil\\b",
            "\\bcooling system\\b", "\\bhydraulics?\\b", "\\bswitchboards?\\b",
            "\\brunning hours\\b", "\\bservice intervals?\\b", "\\b(kw|bhp|rpm)\\b");

    /** Explicit requests for depth; 4 points per match. */
    static final List<Pattern> DEPTH_PHRASES = compileAll(
            "\\bin (more )?detail\\b", "\\bdetailed\\b", "\\btechnical (details?|specs|specifications)\\b",
            "\\bdeep dive\\b", "\\bcomprehensive\\b", "\\bfull specifications?\\b",
            "\\bstep[- ]by[- ]step\\b", "\\bbreak (it )?down\\b", "\\bin[- ]depth\\b");

    /** "yes, more details please" after a turn about a concrete entity. */
    static final Pattern ACKNOWLEDGE_AND_EXPAND = Pattern.compile(
            "^(yes|yeah|sure|ok|okay|please|great|thanks)\\b.*\\b(more|details?|specifics|elaborate|deeper|expand)\\b",
            Pattern.CASE_INSENSITIVE);

    static final String EVALUATION_INTENT = "evaluating fleetcore";

    // ── Matching ─────────────────────────────────────────────────────────────

    static boolean isPlatformQuery(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        return PLATFORM_WORD_PATTERNS.stream().anyMatch(p -> p.matcher(query).find())
                || PLATFORM_PHRASES.stream().anyMatch(lower::contains);
    }

    static boolean hasEntityKeyword(String query) {
        return ENTITY_PATTERNS.stream().anyMatch(p -> p.matcher(query).find())
                || VESSEL_PREFIX.matcher(query).find()
                || IDENTIFIER.matcher(query).find();
    }

    static boolean isSystemOrganizationQuery(String query) {
        return anyMatch(SYSTEM_ORGANIZATION, query);
    }

    static boolean isHowToQuery(String query) {
        return anyMatch(HOW_TO, query);
    }

    static boolean anyMatch(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    static int countMatches(List<Pattern> patterns, String text) {
        return (int) patterns.stream().filter(p -> p.matcher(text).find()).count();
    }

    private static Pattern wordPattern(String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static List<Pattern> compileAll(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
