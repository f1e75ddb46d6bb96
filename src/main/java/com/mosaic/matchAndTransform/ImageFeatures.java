package com.mosaic.matchAndTransform;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * Keypoints of one image with their descriptors. Row i of {@code descriptors} belongs to
 * keypoint i.
 */
@Getter
public class ImageFeatures {
    private final List<Keypoint> keypoints;
    private final Mat descriptors;

    public ImageFeatures(List<Keypoint> keypoints, Mat descriptors) {
        if (!descriptors.empty() && descriptors.rows() != keypoints.size()) {
            throw new IllegalArgumentException("Descriptor rows (" + descriptors.rows()
                    + ") do not match keypoint count (" + keypoints.size() + ")");
        }
        this.keypoints = Collections.unmodifiableList(keypoints);
        this.descriptors = descriptors;
    }

    public int size() {
        return keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.isEmpty();
    }
}
