package com.mosaic.matchAndTransform;

public enum MatchStrategy {
    /** FLANN kd-tree search. Fast, may miss the true neighbour. */
    APPROXIMATE,
    /** Brute-force L2 search over every train descriptor. */
    EXHAUSTIVE
}
