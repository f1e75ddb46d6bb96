package com.mosaic.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public final class Keypoint {
    private final double x, y;
}
