package com.mosaic.homography;

/**
 * Thrown when a set of correspondences does not determine a unique, invertible homography,
 * e.g. collinear or repeated points.
 */
public class DegenerateHomographyException extends RuntimeException {

    public DegenerateHomographyException(String message) {
        super(message);
    }
}
