package com.mosaic.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** The two nearest train descriptors found for one query descriptor. */
@AllArgsConstructor
@Getter
public final class NeighborPair {
    private final int queryIdx;
    private final int nearestIdx;
    private final double nearestDistance;
    private final int secondIdx;
    private final double secondDistance;
}
