package com.openforge.fleetcore.research;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Coverage bucket a source URL falls into.
 *
 * Each bucket carries the search terms and sites used when the research loop
 * needs to go looking for a source of that kind.
 */
public enum SourceCategory {

    AIS("ais", "AIS tracking position",
            List.of("marinetraffic.com", "vesselfinder.com", "myshiptracking.com")),
    REGISTRY("registry", "flag registry IMO ship particulars",
            List.of("equasis.org", "imo.org")),
    OWNER("owner", "owner operator fleet list",
            List.of()),
    CLASS("class", "classification society register",
            List.of("dnv.com", "lr.org", "eagle.org", "classnk.or.jp", "bureauveritas.com")),
    DIRECTORY_NEWS("directory_news", "news delivery charter",
            List.of("marinelink.com", "maritime-executive.com", "splash247.com", "offshore-energy.biz")),
    FORUM("forum", "forum discussion",
            List.of("gcaptain.com")),
    OEM("oem", "engine equipment manufacturer",
            List.of("cat.com", "wartsila.com", "man-es.com")),
    OTHER("other", "", List.of());

    private final String       wireName;
    private final String       searchTerms;
    private final List<String> hintSites;

    SourceCategory(String wireName, String searchTerms, List<String> hintSites) {
        this.wireName    = wireName;
        this.searchTerms = searchTerms;
        this.hintSites   = hintSites;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String searchTerms() {
        return searchTerms;
    }

    public List<String> hintSites() {
        return hintSites;
    }
}
