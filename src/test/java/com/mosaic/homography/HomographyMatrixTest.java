package com.mosaic.homography;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HomographyMatrixTest {

    @Test
    void normalizedScalesBottomRightToOne() {
        HomographyMatrix H = HomographyMatrix.normalized(new double[][]{{2, 0, 4}, {0, 2, 6}, {0, 0, 2}});

        assertThat(H.get(2, 2)).isEqualTo(1.0);
        assertThat(H.approximatelyEquals(HomographyMatrix.translation(2, 3), 1e-12)).isTrue();
    }

    @Test
    void normalizingWithZeroCornerIsDegenerate() {
        assertThatThrownBy(() -> HomographyMatrix.normalized(new double[][]{{1, 0, 0}, {0, 1, 0}, {1, 0, 0}}))
                .isInstanceOf(DegenerateHomographyException.class);
    }

    @Test
    void translateIsAppliedAfterTheTransform() {
        HomographyMatrix scale = new HomographyMatrix(new double[][]{{2, 0, 0}, {0, 2, 0}, {0, 0, 1}});

        double[] p = scale.translate(-5, 7).project(3, 4);

        assertThat(p[0]).isCloseTo(1.0, within(1e-12));
        assertThat(p[1]).isCloseTo(15.0, within(1e-12));
    }

    @Test
    void determinantOfScaleAndTranslation() {
        HomographyMatrix H = new HomographyMatrix(new double[][]{{3, 0, 10}, {0, 2, -4}, {0, 0, 1}});

        assertThat(H.determinant()).isCloseTo(6.0, within(1e-12));
        assertThat(HomographyMatrix.translation(100, 50).determinant()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void getDataReturnsACopy() {
        HomographyMatrix H = HomographyMatrix.identity();
        H.getData()[0][0] = 42;

        assertThat(H.get(0, 0)).isEqualTo(1.0);
    }
}
