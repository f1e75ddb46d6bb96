package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrespondenceFilterTest {
    private static final List<Keypoint> QUERY = List.of(
            new Keypoint(1, 1), new Keypoint(2, 2), new Keypoint(3, 3), new Keypoint(4, 4));
    private static final List<Keypoint> TRAIN = List.of(
            new Keypoint(10, 10), new Keypoint(20, 20), new Keypoint(30, 30), new Keypoint(40, 40));

    @Test
    void keepsOnlyUnambiguousMatchesInInputOrder() {
        List<NeighborPair> candidates = List.of(
                new NeighborPair(3, 0, 1.0, 1, 10.0),
                new NeighborPair(0, 1, 9.0, 2, 10.0),
                new NeighborPair(1, 2, 2.0, 3, 4.0),
                new NeighborPair(2, 3, 7.5, 0, 10.0));

        List<Correspondence> accepted = new CorrespondenceFilter(0.75).filter(candidates, QUERY, TRAIN);

        assertThat(accepted).hasSize(2);
        assertThat(accepted.get(0).getX1()).isEqualTo(4);
        assertThat(accepted.get(0).getX2()).isEqualTo(10);
        assertThat(accepted.get(1).getY1()).isEqualTo(2);
        assertThat(accepted.get(1).getY2()).isEqualTo(30);
    }

    @Test
    void tighterThresholdRejectsMore() {
        List<NeighborPair> candidates = List.of(new NeighborPair(0, 0, 7.0, 1, 10.0));

        assertThat(new CorrespondenceFilter(0.75).filter(candidates, QUERY, TRAIN)).hasSize(1);
        assertThat(new CorrespondenceFilter(0.65).filter(candidates, QUERY, TRAIN)).isEmpty();
    }

    @Test
    void zeroDistancesAreAmbiguous() {
        List<NeighborPair> candidates = List.of(new NeighborPair(0, 0, 0.0, 1, 0.0));

        assertThat(new CorrespondenceFilter().filter(candidates, QUERY, TRAIN)).isEmpty();
    }

    @Test
    void matchDelegatesToTheGivenMatcher() {
        KnnMatcher matcher = new KnnMatcher() {
            @Override
            public List<NeighborPair> knn(Mat query, Mat train) {
                return List.of(new NeighborPair(1, 1, 1.0, 0, 5.0));
            }

            @Override
            public MatchStrategy strategy() {
                return MatchStrategy.EXHAUSTIVE;
            }
        };
        ImageFeatures frame = new ImageFeatures(QUERY, new Mat());
        ImageFeatures reference = new ImageFeatures(TRAIN, new Mat());

        List<Correspondence> matches = new CorrespondenceFilter().match(matcher, frame, reference);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getX1()).isEqualTo(2);
        assertThat(matches.get(0).getX2()).isEqualTo(20);
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new CorrespondenceFilter(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CorrespondenceFilter(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
