package org.hourglass.waterfall;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link Waterfall}.
 */
@Value
@Builder
public class WaterfallConfig {
    /**
     * Fuse nodes left with two edges after each commit merge.
     */
    @Builder.Default
    boolean removeDegree2Nodes = true;

    public static WaterfallConfig defaults() {
        return builder().build();
    }
}
