package org.netpreserve.sweeper;

import java.util.List;

/**
 * Which items to fetch heavy data for, decided once per crawl after light sync.
 */
public sealed interface HeavyPlan permits HeavyPlan.FullSweep, HeavyPlan.Targeted, HeavyPlan.LightOnly {
    /**
     * Items considered by this crawl, highest id first. Items outside this snapshot are left for a later crawl.
     */
    List<Item> candidates();

    /**
     * First visit of a new target: every known item is fetched and the target is marked swept afterwards.
     */
    record FullSweep(List<Item> candidates) implements HeavyPlan {
        public FullSweep {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * Target already swept: only items flagged for update are fetched.
     */
    record Targeted(List<Item> candidates) implements HeavyPlan {
        public Targeted {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * Listing-only crawl: no detail pages are visited and the target's sweep state is left alone.
     */
    record LightOnly() implements HeavyPlan {
        @Override
        public List<Item> candidates() {
            return List.of();
        }
    }
}
