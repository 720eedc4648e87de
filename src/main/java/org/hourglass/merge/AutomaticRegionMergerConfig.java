package org.hourglass.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link AutomaticRegionMerger}.
 */
@Value
@Builder
public class AutomaticRegionMergerConfig {
    /**
     * Append the cost of every successful merge step to the merger's cost log.
     */
    @Builder.Default
    boolean recordCosts = false;

    /**
     * Fuse nodes left with two edges after each merge.
     */
    @Builder.Default
    boolean removeDegree2Nodes = true;

    public static AutomaticRegionMergerConfig defaults() {
        return builder().build();
    }
}
