package com.netai.insights.engine.dbscan;

import com.netai.insights.engine.ModelOutput;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DbscanTest {

    @Test
    void cluster_twoDenseGroupsAndNoise() {
        double[][] data = twoClustersWithNoise();
        Dbscan dbscan = new Dbscan(0.5, 5);

        int[] labels = dbscan.cluster(data);

        assertThat(dbscan.getClusterCount()).isEqualTo(2);
        assertThat(labels[0]).isEqualTo(labels[14]);
        assertThat(labels[15]).isEqualTo(labels[29]);
        assertThat(labels[0]).isNotEqualTo(labels[15]);
        assertThat(labels[30]).isEqualTo(Dbscan.NOISE);
        assertThat(labels[31]).isEqualTo(Dbscan.NOISE);
    }

    @Test
    void fitAndScore_noiseIsAnomalyAndHasNoRawScores() {
        Dbscan dbscan = new Dbscan(0.5, 5);

        ModelOutput output = dbscan.fitAndScore(twoClustersWithNoise());

        assertThat(output.hasRawScores()).isFalse();
        assertThat(output.anomalies()[0]).isFalse();
        assertThat(output.anomalies()[30]).isTrue();
        assertThat(output.anomalies()[31]).isTrue();
    }

    @Test
    void score_newPointNearCoreSampleIsNormal() {
        Dbscan dbscan = new Dbscan(0.5, 5);
        dbscan.fitAndScore(twoClustersWithNoise());

        ModelOutput output = dbscan.score(new double[][]{{0.05, 0.05}, {20.0, 20.0}});

        assertThat(output.anomalies()).containsExactly(false, true);
    }

    @Test
    void cluster_minSamplesCountsThePointItself() {
        double[][] pair = {{0.0, 0.0}, {0.1, 0.0}};

        assertThat(new Dbscan(0.5, 2).cluster(pair)).containsExactly(0, 0);
        assertThat(new Dbscan(0.5, 3).cluster(pair)).containsExactly(Dbscan.NOISE, Dbscan.NOISE);
    }

    @Test
    void score_beforeFit_throws() {
        assertThatThrownBy(() -> new Dbscan(0.5, 5).score(new double[][]{{0.0}}))
                .isInstanceOf(IllegalStateException.class);
    }

    // rows 0-14 around (0,0), rows 15-29 around (5,5), rows 30-31 isolated
    private static double[][] twoClustersWithNoise() {
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            rows.add(new double[]{(i % 5) * 0.05, (i / 5) * 0.05});
        }
        for (int i = 0; i < 15; i++) {
            rows.add(new double[]{5.0 + (i % 5) * 0.05, 5.0 + (i / 5) * 0.05});
        }
        rows.add(new double[]{-8.0, 3.0});
        rows.add(new double[]{10.0, -10.0});
        return rows.toArray(new double[0][]);
    }
}
