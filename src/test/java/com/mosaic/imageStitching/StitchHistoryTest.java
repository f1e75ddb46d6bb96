package com.mosaic.imageStitching;

import com.mosaic.TestImages;
import com.mosaic.homography.HomographyMatrix;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StitchHistoryTest {

    private static StitchRecord record(int x, int y, HomographyMatrix h, Object metadata) {
        Mat img = TestImages.solid(4, 4, 1, 2, 3, 255);
        return new StitchRecord(img, img, new Mat(), x, y, h, metadata);
    }

    @Test
    void emptyHistoryHasNoLastRecord() {
        StitchHistory history = new StitchHistory();

        assertThat(history.isEmpty()).isTrue();
        assertThat(history.last()).isNull();
    }

    @Test
    void keepsStitchingOrder() {
        StitchHistory history = new StitchHistory();
        StitchRecord first = record(0, 0, HomographyMatrix.identity(), "a");
        StitchRecord second = record(7, 3, HomographyMatrix.translation(7, 3), "b");
        history.append(first);
        history.append(second);

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.get(0)).isSameAs(first);
        assertThat(history.last()).isSameAs(second);
        assertThat(history).containsExactly(first, second);
        assertThatThrownBy(() -> history.asList().add(first)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recordCarriesDeterminantAndDescribesItself() {
        HomographyMatrix scale = new HomographyMatrix(new double[][]{{2, 0, 0}, {0, 0.5, 0}, {0, 0, 1}});
        StitchRecord r = record(12, -4, scale, "frame-3");

        assertThat(r.getDeterminant()).isEqualTo(1.0);
        assertThat(r.isDegenerate()).isFalse();
        assertThat(r.getTimestamp()).isNotNull();
        assertThat(r.toString()).isEqualTo("Determinant: 1.000000, Warped Image Coords: (12, -4), Metadata: frame-3");
    }
}
