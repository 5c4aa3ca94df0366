package com.openforge.fleetcore.research;

import java.util.List;

/**
 * Result of one gap-analysis pass.
 *
 * @param completeness            0..100
 * @param needsAdditionalResearch the research loop's continue predicate
 */
public record GapAnalysis(
        List<ResearchGap> gaps,
        int               completeness,
        boolean           needsAdditionalResearch,
        int               iteration
) {

    public GapAnalysis {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public long count(GapImportance importance) {
        return gaps.stream().filter(g -> g.importance() == importance).count();
    }

    public boolean hasCriticalGaps() {
        return count(GapImportance.CRITICAL) > 0;
    }
}
