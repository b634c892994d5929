package com.netai.insights.engine.normalizers;

import com.netai.insights.config.DetectionConfig;
import com.netai.insights.engine.ModelOutput;
import com.netai.insights.engine.ScoreRange;
import com.netai.insights.exception.DegenerateScaleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreNormalizerTest {

    private DetectionConfig config;
    private IsolationScoreNormalizer isolationNormalizer;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        isolationNormalizer = new IsolationScoreNormalizer(config);
    }

    @Test
    void isolation_lowestDecisionBecomesOne() {
        ModelOutput output = new ModelOutput(new boolean[]{true, false, false}, new double[]{-0.2, 0.0, 0.2}, null);

        double[] scores = isolationNormalizer.normalize(output);

        assertThat(scores[0]).isEqualTo(1.0);
        assertThat(scores[1]).isCloseTo(0.5, within(1e-12));
        assertThat(scores[2]).isEqualTo(0.0);
    }

    @Test
    void isolation_referenceRangeClampsOutOfRangeScores() {
        ModelOutput output = new ModelOutput(new boolean[]{true, false},
                new double[]{-0.4, 0.4}, new ScoreRange(-0.2, 0.2));

        assertThat(isolationNormalizer.normalize(output)).containsExactly(1.0, 0.0);
    }

    @Test
    void isolation_zeroRangeUsesConstantScoreByDefault() {
        ModelOutput output = new ModelOutput(new boolean[3], new double[]{0.1, 0.1, 0.1}, null);

        assertThat(isolationNormalizer.normalize(output)).containsExactly(0.5, 0.5, 0.5);
    }

    @Test
    void isolation_zeroRangeFailsWhenConfigured() {
        config.setDegenerateScalePolicy(DetectionConfig.DegenerateScalePolicy.FAIL);
        ModelOutput output = new ModelOutput(new boolean[2], new double[]{0.1, 0.1}, null);

        assertThatThrownBy(() -> isolationNormalizer.normalize(output))
                .isInstanceOf(DegenerateScaleException.class)
                .hasMessageContaining("2 scores");
    }

    @Test
    void isolation_singleScoreIsDegenerate() {
        ModelOutput output = new ModelOutput(new boolean[1], new double[]{-0.3}, null);

        assertThat(isolationNormalizer.normalize(output)).containsExactly(0.5);
    }

    @Test
    void boundaryDistance_negatesWithoutRescaling() {
        ModelOutput output = new ModelOutput(new boolean[]{false, true}, new double[]{1.5, -3.25}, null);

        assertThat(new BoundaryDistanceNormalizer().normalize(output)).containsExactly(-1.5, 3.25);
    }

    @Test
    void clusterLabel_mapsNoiseAndMembersToFixedScores() {
        ModelOutput output = ModelOutput.labelsOnly(new boolean[]{true, false, true});

        assertThat(new ClusterLabelNormalizer(config).normalize(output)).containsExactly(0.8, 0.2, 0.8);
    }

    @Test
    void clusterLabel_scoresAreConfigurable() {
        config.getDbscan().setAnomalyScore(1.0);
        config.getDbscan().setNormalScore(0.0);

        assertThat(new ClusterLabelNormalizer(config).normalize(ModelOutput.labelsOnly(new boolean[]{true, false})))
                .containsExactly(1.0, 0.0);
    }
}
