package org.hourglass.srg;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link SeededRegionGrowing}.
 */
@Value
@Builder
public class SeededRegionGrowingConfig {
    @Builder.Default
    GrowthPolicy policy = GrowthPolicy.DYNAMIC;

    /**
     * Fuse nodes left with two edges after each merge.
     */
    @Builder.Default
    boolean removeDegree2Nodes = true;

    /**
     * Record absorbed faces and their costs.
     */
    @Builder.Default
    boolean recordCosts = true;

    public static SeededRegionGrowingConfig defaults() {
        return builder().build();
    }
}
