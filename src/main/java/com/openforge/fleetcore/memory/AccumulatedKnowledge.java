package com.openforge.fleetcore.memory;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured facts gathered over the life of a conversation.
 *
 * Entity maps are keyed by name and keep discovery order: the last entry is
 * the most recently discovered entity. Re-observing a known entity merges into
 * the existing entry without moving it.
 */
@Getter
public class AccumulatedKnowledge {

    private final List<PlatformFeature>         platformFeatures = new ArrayList<>();
    private final Map<String, VesselEntity>     vesselEntities   = new LinkedHashMap<>();
    private final Map<String, CompanyEntity>    companyEntities  = new LinkedHashMap<>();
    private final List<String>                  discussedTopics  = new ArrayList<>();

    // ── Features ─────────────────────────────────────────────────────────────

    /** Records a feature once; repeated mentions keep the first explanation. */
    public boolean addPlatformFeature(PlatformFeature feature) {
        boolean known = platformFeatures.stream()
                .anyMatch(f -> f.name().equalsIgnoreCase(feature.name()));
        if (known) return false;
        platformFeatures.add(feature);
        return true;
    }

    public boolean hasPlatformFeatures() {
        return !platformFeatures.isEmpty();
    }

    // ── Entities ─────────────────────────────────────────────────────────────

    public void addVessel(VesselEntity vessel) {
        vesselEntities.merge(vessel.name(), vessel, VesselEntity::mergeWith);
    }

    public void addCompany(CompanyEntity company) {
        companyEntities.putIfAbsent(company.name(), company);
    }

    /** The vessel added last, if any. */
    public Optional<VesselEntity> latestVessel() {
        return last(vesselEntities);
    }

    /** The company added last, if any. */
    public Optional<CompanyEntity> latestCompany() {
        return last(companyEntities);
    }

    // ── Topics ───────────────────────────────────────────────────────────────

    public void addTopics(List<String> topics) {
        for (String topic : topics) {
            if (!discussedTopics.contains(topic)) {
                discussedTopics.add(topic);
            }
        }
    }

    public List<String> topicsView() {
        return Collections.unmodifiableList(discussedTopics);
    }

    private static <V> Optional<V> last(Map<String, V> map) {
        V last = null;
        for (V value : map.values()) {
            last = value;
        }
        return Optional.ofNullable(last);
    }
}
