package com.mosaic.homography;

import com.mosaic.matchAndTransform.Correspondence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RansacHomographyEstimatorTest {
    private static final HomographyMatrix TRUTH = new HomographyMatrix(new double[][]{
            {1.05, 0.02, 30},
            {-0.01, 0.98, -12},
            {5e-5, -3e-5, 1}});

    /** 80 inliers of TRUTH and 20 outliers, shuffled with a fixed seed. */
    private static List<Correspondence> contaminated(long seed) {
        Random rnd = new Random(seed);
        List<Correspondence> matches = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            double x = rnd.nextDouble() * 640, y = rnd.nextDouble() * 480;
            double[] q = TRUTH.project(x, y);
            matches.add(new Correspondence(x, y, q[0] + rnd.nextGaussian() * 0.3, q[1] + rnd.nextGaussian() * 0.3));
        }
        for (int i = 0; i < 20; i++) {
            matches.add(new Correspondence(rnd.nextDouble() * 640, rnd.nextDouble() * 480,
                    rnd.nextDouble() * 640, rnd.nextDouble() * 480));
        }
        Collections.shuffle(matches, rnd);
        return matches;
    }

    @Test
    void recoversModelDespiteOutliers() {
        List<Correspondence> matches = contaminated(7);
        RansacHomographyEstimator ransac = new RansacHomographyEstimator(new HomographyEstimator(), new Random(42));

        HomographyMatrix H = ransac.estimate(matches, 4, 4.0, 200);

        assertThat(H).isNotNull();
        for (double[] corner : new double[][]{{0, 0}, {640, 0}, {640, 480}, {0, 480}, {320, 240}}) {
            double[] expected = TRUTH.project(corner[0], corner[1]);
            double[] actual = H.project(corner[0], corner[1]);
            assertThat(Math.hypot(expected[0] - actual[0], expected[1] - actual[1])).isLessThan(2.0);
        }

        double[] errors = new HomographyEstimator().reprojectionError(matches, H);
        long inliers = java.util.Arrays.stream(errors).filter(e -> e < 4.0).count();
        assertThat(inliers).isGreaterThanOrEqualTo(60);
    }

    @Test
    void parallelTrialsGiveTheSameAnswerAsSequential() {
        List<Correspondence> matches = contaminated(11);

        HomographyMatrix sequential = new RansacHomographyEstimator(new HomographyEstimator(), new Random(3), false)
                .estimate(matches, 6, 4.0, 150);
        HomographyMatrix parallel = new RansacHomographyEstimator(new HomographyEstimator(), new Random(3), true)
                .estimate(matches, 6, 4.0, 150);

        assertThat(sequential).isNotNull();
        assertThat(parallel.approximatelyEquals(sequential, 0.0)).isTrue();
    }

    @Test
    void returnsNullWhenEverySampleIsDegenerate() {
        List<Correspondence> line = new ArrayList<>();
        for (int i = 0; i < 10; i++) line.add(new Correspondence(i, 2 * i, i + 5, 2 * i + 5));
        RansacHomographyEstimator ransac = new RansacHomographyEstimator(new HomographyEstimator(), new Random(1));

        assertThat(ransac.estimate(line, 4, 4.0, 50)).isNull();
    }

    @Test
    void callerMutationDuringEstimateDoesNotAffectResult() {
        List<Correspondence> copy = contaminated(5);
        ClearOnReadList matches = new ClearOnReadList(copy);

        HomographyMatrix a = new RansacHomographyEstimator(new HomographyEstimator(), new Random(9)).estimate(matches, 4, 4.0, 100);
        HomographyMatrix b = new RansacHomographyEstimator(new HomographyEstimator(), new Random(9)).estimate(copy, 4, 4.0, 100);

        assertThat(matches).as("list emptied while the estimate ran").isEmpty();
        assertThat(a).isNotNull();
        assertThat(a.approximatelyEquals(b, 0.0)).isTrue();
    }

    /** Empties itself right after its elements are first read. */
    private static final class ClearOnReadList extends ArrayList<Correspondence> {
        ClearOnReadList(List<Correspondence> source) {
            super(source);
        }

        @Override
        public Object[] toArray() {
            Object[] elements = super.toArray();
            clear();
            return elements;
        }

        @Override
        public Correspondence get(int index) {
            Correspondence c = super.get(index);
            clear();
            return c;
        }

        @Override
        public Iterator<Correspondence> iterator() {
            Iterator<Correspondence> it = new ArrayList<>(this).iterator();
            clear();
            return it;
        }
    }

    @Test
    void rejectsInvalidSampleSizes() {
        List<Correspondence> matches = contaminated(2);
        RansacHomographyEstimator ransac = new RansacHomographyEstimator(new HomographyEstimator(), new Random(1));

        assertThatThrownBy(() -> ransac.estimate(matches, 3, 4.0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ransac.estimate(matches, 101, 4.0, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
