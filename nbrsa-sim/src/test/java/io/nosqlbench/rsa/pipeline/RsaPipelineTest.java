/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.rsa.pipeline;

import io.nosqlbench.rsa.cluster.RoiProfile;
import io.nosqlbench.rsa.dataset.DatasetSize;
import io.nosqlbench.rsa.exceptions.InvalidClusterSpecException;
import io.nosqlbench.rsa.rdm.DistanceMetric;
import io.nosqlbench.rsa.regression.RegressionMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class RsaPipelineTest {

    private static SimulationConfig pooledSubjects(RoiProfile roi) {
        return new SimulationConfig(8, 10, 10, 1, 0.6, 42L, DatasetSize.HUGE, roi,
            DistanceMetric.CORRELATION, true, RegressionMode.OLS);
    }

    @Test
    public void testSameConfigGivesSameResult() {
        SimulationConfig config = SimulationConfig.defaults();
        RsaAnalysisResult first = new RsaPipeline().run(config);
        RsaAnalysisResult second = new RsaPipeline().run(config);

        assertArrayEquals(first.clustered().dataset().getSamples(), second.clustered().dataset().getSamples());
        assertArrayEquals(first.observedRdm().getMatrix(), second.observedRdm().getMatrix());
        assertArrayEquals(first.regression().getCoefficients(), second.regression().getCoefficients());
        assertEquals(first.decoding().accuracy(), second.decoding().accuracy());
    }

    @Test
    public void testDifferentSeedsDiffer() {
        RsaAnalysisResult first = new RsaPipeline().run(SimulationConfig.defaults());
        RsaAnalysisResult second = new RsaPipeline().run(SimulationConfig.defaults().withSeed(43L));
        assertThat(first.observedRdm().get(0, 7)).isNotEqualTo(second.observedRdm().get(0, 7));
    }

    @Test
    public void testDefaultRunProducesEveryStage() {
        RsaAnalysisResult result = new RsaPipeline().run(SimulationConfig.defaults());

        assertEquals("IT categorical", result.clustered().schemeName());
        assertEquals(5, result.clustered().appliedSpecs().size());
        assertTrue(result.clustered().dataset().isFrozen());
        assertEquals(80, result.clustered().dataset().getObservationCount());
        assertEquals(6, result.clustered().dataset().getFeatureCount());
        assertNotNull(result.decoding());
        assertEquals(8, result.observedRdm().size());
        assertThat(result.observedRdm().getLabels()).startsWith("human face", "human body");
        assertThat(result.modelRdms()).hasSize(3);
        assertThat(result.regression().getModelDescriptions())
            .containsExactly("Animate vs. Inanimate", "Grouped Pairs", "Round vs. Spiky");
    }

    @Test
    public void testV1ProfileFavorsShapeModel() {
        RsaAnalysisResult result = new RsaPipeline().run(pooledSubjects(RoiProfile.V1));
        assertEquals("Round vs. Spiky", result.regression().bestModel());
        assertThat(result.regression().coefficientFor("Round vs. Spiky")).isPositive();
    }

    @Test
    public void testItProfileDiscountsShapeModel() {
        RsaAnalysisResult result = new RsaPipeline().run(pooledSubjects(RoiProfile.IT));
        assertThat(result.regression().bestModel()).isNotEqualTo("Round vs. Spiky");
        assertThat(result.regression().coefficientFor("Animate vs. Inanimate")).isPositive();
    }

    @Test
    public void testSingleRunSkipsDecoding() {
        SimulationConfig config = new SimulationConfig(8, 1, 1, 2, 0.6, 7L, DatasetSize.NORMAL, RoiProfile.IT,
            DistanceMetric.CORRELATION, true, RegressionMode.OLS);
        RsaAnalysisResult result = new RsaPipeline().run(config);
        assertNull(result.decoding());
        assertEquals(8, result.observedRdm().size());
    }

    @Test
    public void testTooFewCategoriesForProfile() {
        SimulationConfig config = new SimulationConfig(6, 1, 10, 1, 0.6, 42L, DatasetSize.NORMAL, RoiProfile.IT,
            DistanceMetric.CORRELATION, true, RegressionMode.OLS);
        assertThrows(InvalidClusterSpecException.class, () -> new RsaPipeline().run(config));
    }

    @Test
    public void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SimulationConfig(1, 1, 10, 1, 0.6, 42L,
            DatasetSize.NORMAL, RoiProfile.IT, DistanceMetric.CORRELATION, true, RegressionMode.OLS));
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.defaults().withNoiseSigma(-0.1));
    }
}
