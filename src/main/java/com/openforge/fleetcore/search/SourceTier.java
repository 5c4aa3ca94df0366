package com.openforge.fleetcore.search;

/**
 * Authority tier attached to a source by the search collaborator.
 *
 *   T1: registries, class societies, AIS providers
 *   T2: trade press, operator sites
 *   T3: forums, aggregators, everything else
 */
public enum SourceTier {
    T1,
    T2,
    T3
}
