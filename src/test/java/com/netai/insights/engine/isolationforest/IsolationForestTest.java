package com.netai.insights.engine.isolationforest;

import com.netai.insights.engine.ModelOutput;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        // 2 * (ln 255 + 0.5772156649) - 2 * 255 / 256
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    void percentile_interpolatesLinearly() {
        double[] values = {4.0, 1.0, 3.0, 2.0, 5.0};

        assertThat(IsolationForest.percentile(values, 0.0)).isEqualTo(1.0);
        assertThat(IsolationForest.percentile(values, 50.0)).isEqualTo(3.0);
        assertThat(IsolationForest.percentile(values, 10.0)).isCloseTo(1.4, within(1e-12));
        assertThat(IsolationForest.percentile(values, 100.0)).isEqualTo(5.0);
    }

    @Test
    void constructor_rejectsContaminationOutOfRange() {
        assertThatThrownBy(() -> new IsolationForest(10, 64, 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForest(10, 64, 0.6, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fitAndScore_flagsAtMostContaminationShare() {
        double[][] data = gaussianCloud(200, 3, 11L);
        IsolationForest forest = new IsolationForest(100, 256, 0.1, 42L);

        ModelOutput output = forest.fitAndScore(data);

        int flagged = 0;
        for (boolean anomaly : output.anomalies()) {
            if (anomaly) flagged++;
        }
        assertThat(flagged).isBetween(1, 20);
        assertThat(forest.getSampleSize()).isEqualTo(200);
        assertThat(forest.getTrees()).hasSize(100);
        assertThat(output.referenceRange()).isNull();
    }

    @Test
    void fitAndScore_isolatedPointScoresHighest() {
        double[][] data = gaussianCloud(100, 2, 3L);
        data[0] = new double[]{12.0, -12.0};
        IsolationForest forest = new IsolationForest(100, 256, 0.1, 42L);

        ModelOutput output = forest.fitAndScore(data);

        assertThat(output.anomalies()[0]).isTrue();
        for (int i = 1; i < data.length; i++) {
            assertThat(output.rawScores()[0]).isLessThan(output.rawScores()[i]);
        }
        assertThat(forest.isolationScore(data[0])).isGreaterThan(0.6);
    }

    @Test
    void fitAndScore_sameSeedSameScores() {
        double[][] data = gaussianCloud(80, 4, 5L);

        double[] first = new IsolationForest(50, 256, 0.1, 42L).fitAndScore(data).rawScores();
        double[] second = new IsolationForest(50, 256, 0.1, 42L).fitAndScore(data).rawScores();

        assertThat(first).containsExactly(second);
    }

    @Test
    void score_reportsTrainingRangeForNormalization() {
        double[][] data = gaussianCloud(60, 2, 8L);
        IsolationForest forest = new IsolationForest(30, 256, 0.1, 42L);
        forest.fitAndScore(data);

        ModelOutput output = forest.score(new double[][]{{0.0, 0.0}});

        assertThat(output.referenceRange()).isEqualTo(forest.getTrainingRange());
        assertThat(output.rawScores()[0]).isEqualTo(forest.decisionFunction(new double[]{0.0, 0.0}));
    }

    @Test
    void score_beforeFit_throws() {
        IsolationForest forest = new IsolationForest(10, 64, 0.1, 1L);

        assertThatThrownBy(() -> forest.score(new double[][]{{0.0}}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void consistentWith_matchesTheFittedWidthOnly() {
        IsolationForest forest = new IsolationForest(50, 256, 0.1, 42L);
        assertThat(forest.consistentWith(3)).isFalse();

        forest.fitAndScore(gaussianCloud(120, 3, 13L));

        assertThat(forest.consistentWith(3)).isTrue();
        // fifty trees over three columns always split on the last one somewhere
        assertThat(forest.consistentWith(2)).isFalse();
    }

    static double[][] gaussianCloud(int n, int d, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                data[i][j] = random.nextGaussian();
            }
        }
        return data;
    }
}
