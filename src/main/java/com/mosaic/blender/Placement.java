package com.mosaic.blender;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Top-left corner of an image on the canvas, in canvas pixels. */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public final class Placement {
    public static final Placement ORIGIN = new Placement(0, 0);

    private final int x;
    private final int y;

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
