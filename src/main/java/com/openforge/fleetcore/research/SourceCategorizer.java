package com.openforge.fleetcore.research;

import com.openforge.fleetcore.search.Source;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sorts source URLs into coverage buckets and reports which of the buckets a
 * complete vessel profile needs are still empty.
 *
 * Rules run in a fixed order and the first hit wins. News and directory sites
 * are tested before owner/operator rules because some news hosts contain
 * operator-like words ("marinelink" has "marine").
 */
@Component
public class SourceCategorizer {

    /** Buckets a vessel profile is expected to draw on. */
    public static final List<SourceCategory> REQUIRED = List.of(
            SourceCategory.AIS,
            SourceCategory.REGISTRY,
            SourceCategory.OWNER,
            SourceCategory.CLASS,
            SourceCategory.DIRECTORY_NEWS);

    private static final List<String> AIS_TOKENS = List.of(
            "vesselfinder", "marinetraffic", "myshiptracking", "vesseltracker", "fleetmon");
    private static final List<String> REGISTRY_TOKENS = List.of(
            "equasis", "imo.org", "shipregistry", "svgmaritime", "stvincent", "flagstate");
    private static final List<String> NEWS_TOKENS = List.of(
            "marinelink", "maritime-executive", "splash247", "tradewinds", "offshore-energy",
            "ijetty", "directory");
    private static final List<String> OWNER_TOKENS = List.of(
            "stanfordmarine", "shipmanagement", "offshore.com");
    private static final List<String> CLASS_TOKENS = List.of(
            "dnv.com", "lr.org", "eagle.org", "classnk", "bureauveritas", "veristar", "bv.com");
    private static final List<String> FORUM_TOKENS = List.of(
            "gcaptain", "forum", "reddit.com/r/maritime");
    private static final List<String> OEM_TOKENS = List.of(
            "cat.com", "wartsila", "man-es", "rolls-royce", "abb.com", "kongsberg");

    private static final Pattern SHIPPING_WORD = Pattern.compile("\\bshipping\\b");
    private static final Pattern OWNER_PATH    = Pattern.compile(
            "/(our-)?fleet\\b|/vessel-chartering\\b|/chartering\\b|/vessels?/?$");
    private static final Pattern NEWS_PATH     = Pattern.compile(
            "/(news|press|articles?|blog|magazine)\\b");

    // ── Categorize ───────────────────────────────────────────────────────────

    public SourceCategory categorize(String url) {
        if (url == null || url.isBlank()) return SourceCategory.OTHER;
        String raw = url.trim().toLowerCase(Locale.ROOT);

        String host;
        String path;
        try {
            URI uri = URI.create(raw);
            host = uri.getHost();
            path = uri.getPath() == null ? "" : uri.getPath();
        } catch (IllegalArgumentException e) {
            return categorizeRaw(raw);
        }
        if (host == null) return categorizeRaw(raw);

        String location = host + path;
        if (containsAny(host, AIS_TOKENS))          return SourceCategory.AIS;
        if (containsAny(location, REGISTRY_TOKENS)) return SourceCategory.REGISTRY;
        if (containsAny(location, NEWS_TOKENS))     return SourceCategory.DIRECTORY_NEWS;
        if (isOwnerSite(host, path))                return SourceCategory.OWNER;
        if (containsAny(host, CLASS_TOKENS))        return SourceCategory.CLASS;
        if (containsAny(location, FORUM_TOKENS))    return SourceCategory.FORUM;
        if (containsAny(host, OEM_TOKENS))          return SourceCategory.OEM;
        return SourceCategory.OTHER;
    }

    private static boolean isOwnerSite(String host, String path) {
        if (containsAny(host, OWNER_TOKENS) || SHIPPING_WORD.matcher(host).find()) return true;
        return OWNER_PATH.matcher(path).find() && !NEWS_PATH.matcher(path).find();
    }

    /** Same priority order, applied to the raw URL text when it does not parse. */
    private static SourceCategory categorizeRaw(String raw) {
        if (containsAny(raw, AIS_TOKENS))      return SourceCategory.AIS;
        if (containsAny(raw, REGISTRY_TOKENS)) return SourceCategory.REGISTRY;
        if (containsAny(raw, NEWS_TOKENS))     return SourceCategory.DIRECTORY_NEWS;
        if (containsAny(raw, OWNER_TOKENS) || SHIPPING_WORD.matcher(raw).find()) return SourceCategory.OWNER;
        if (containsAny(raw, CLASS_TOKENS))    return SourceCategory.CLASS;
        if (containsAny(raw, FORUM_TOKENS))    return SourceCategory.FORUM;
        if (containsAny(raw, OEM_TOKENS))      return SourceCategory.OEM;
        return SourceCategory.OTHER;
    }

    private static boolean containsAny(String text, List<String> tokens) {
        for (String token : tokens) {
            if (text.contains(token)) return true;
        }
        return false;
    }

    // ── Coverage ─────────────────────────────────────────────────────────────

    /** Histogram over every category; categories with no sources map to 0. */
    public Map<SourceCategory, Integer> computeCoverage(Collection<Source> sources) {
        Map<SourceCategory, Integer> coverage = new EnumMap<>(SourceCategory.class);
        for (SourceCategory category : SourceCategory.values()) {
            coverage.put(category, 0);
        }
        if (sources == null) return coverage;
        for (Source source : sources) {
            if (source == null) continue;
            coverage.merge(categorize(source.url()), 1, Integer::sum);
        }
        return coverage;
    }

    /** Required categories with no source, in {@link #REQUIRED} order. */
    public List<SourceCategory> missingCoverage(Map<SourceCategory, Integer> coverage) {
        return REQUIRED.stream()
                .filter(category -> coverage == null || coverage.getOrDefault(category, 0) == 0)
                .toList();
    }
}
