package com.mosaic.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A matched point pair: (x1, y1) lies in the new frame, (x2, y2) in the reference image.
 */
@AllArgsConstructor
@Getter
public final class Correspondence {
    private final double x1, y1;
    private final double x2, y2;

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f) -> (%.2f, %.2f)", x1, y1, x2, y2);
    }
}
