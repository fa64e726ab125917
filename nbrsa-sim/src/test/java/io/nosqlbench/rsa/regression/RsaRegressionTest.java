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

package io.nosqlbench.rsa.regression;

import io.nosqlbench.rsa.cluster.ClusterSpec;
import io.nosqlbench.rsa.cluster.ClusteringScheme;
import io.nosqlbench.rsa.dataset.Dataset;
import io.nosqlbench.rsa.exceptions.DegenerateModelRdmException;
import io.nosqlbench.rsa.exceptions.DimensionMismatchException;
import io.nosqlbench.rsa.rdm.DistanceMetric;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.rdm.ModelRdmGenerator;
import io.nosqlbench.rsa.rdm.ModelSchemes;
import io.nosqlbench.rsa.rdm.ObservedRdm;
import io.nosqlbench.rsa.rdm.ObservedRdmBuilder;
import io.nosqlbench.rsa.rdm.ObservedRdmBuilderTest;
import io.nosqlbench.rsa.rdm.RdmMatrices;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class RsaRegressionTest {

    private static final ClusteringScheme CROSSED_PAIRS = ClusteringScheme.of("Crossed Pairs",
        ClusterSpec.grouping("face-round", 1, 5),
        ClusterSpec.grouping("body-spiky", 2, 6),
        ClusterSpec.grouping("animal face-artificial", 3, 7),
        ClusterSpec.grouping("animal body-artificial", 4, 8));

    private static List<ModelRdm> candidateModels() {
        return new ModelRdmGenerator().generate(8,
            List.of(CROSSED_PAIRS, ModelSchemes.ANIMATE_INANIMATE, ModelSchemes.ROUND_SPIKY));
    }

    @ParameterizedTest(name = "mode={0}")
    @EnumSource(RegressionMode.class)
    public void testGeneratingSchemeHasLargestCoefficient(RegressionMode mode) {
        Dataset ds = ObservedRdmBuilderTest.twoClusterDataset(0.9, 42L).dataset();
        ObservedRdm observed = new ObservedRdmBuilder(DistanceMetric.CORRELATION, true).build(ds, 8);

        RegressionResult result = new RsaRegression(mode).fit(observed, candidateModels());

        assertEquals("Animate vs. Inanimate", result.bestModel());
        double matched = result.coefficientFor("Animate vs. Inanimate");
        assertThat(matched).isGreaterThan(0.5);
        assertThat(matched).isGreaterThan(result.coefficientFor("Crossed Pairs"));
        assertThat(matched).isGreaterThan(result.coefficientFor("Round vs. Spiky"));
        assertThat(result.getRSquared()).isGreaterThan(0.6);
    }

    @Test
    public void testCoefficientsFollowModelOrder() {
        Dataset ds = ObservedRdmBuilderTest.twoClusterDataset(0.9, 42L).dataset();
        ObservedRdm observed = new ObservedRdmBuilder().build(ds, 8);
        List<ModelRdm> models = candidateModels();
        Collections.reverse(models);

        RegressionResult result = new RsaRegression().fit(observed, models);

        assertThat(result.getModelDescriptions())
            .containsExactly("Round vs. Spiky", "Animate vs. Inanimate", "Crossed Pairs");
        assertEquals(result.coefficientFor("Animate vs. Inanimate"), result.getCoefficient(1));
    }

    @Test
    public void testExactModelIsRecoveredWithUnitCoefficient() {
        ModelRdm truth = new ModelRdmGenerator().generate(8, ModelSchemes.GROUPED_PAIRS);
        ObservedRdm observed = new ObservedRdm(truth.getMatrix(), List.of("1", "2", "3", "4", "5", "6", "7", "8"));

        RegressionResult result = new RsaRegression().fit(observed, List.of(truth));

        assertEquals(1.0, result.getCoefficient(0), 1e-9);
        assertEquals(1.0, result.getRSquared(), 1e-9);
    }

    @Test
    public void testDimensionMismatch() {
        ModelRdm truth = new ModelRdmGenerator().generate(8, ModelSchemes.ANIMATE_INANIMATE);
        ObservedRdm observed = new ObservedRdm(truth.getMatrix(), List.of("1", "2", "3", "4", "5", "6", "7", "8"));
        ModelRdm small = new ModelRdmGenerator().generate(6, ClusteringScheme.of("six",
            ClusterSpec.grouping("a", 1, 2, 3), ClusterSpec.grouping("b", 4, 5, 6)));

        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
            () -> new RsaRegression().fit(observed, List.of(truth, small)));
        assertEquals(8, e.getExpected());
        assertEquals(6, e.getActual());
        assertThat(e.getMessage()).contains("six");
    }

    @Test
    public void testConstantModelIsRejected() {
        ModelRdm truth = new ModelRdmGenerator().generate(4, ClusteringScheme.of("pairs",
            ClusterSpec.grouping("a", 1, 2), ClusterSpec.grouping("b", 3, 4)));
        ModelRdm everything = new ModelRdmGenerator().generate(4, ClusteringScheme.of("one cluster",
            ClusterSpec.grouping("all", 1, 2, 3, 4)));
        double[][] noisy = RdmMatrices.squareform(new double[]{0.1, 1.9, 2.0, 1.8, 1.7, 0.2});
        ObservedRdm observed = new ObservedRdm(noisy, List.of("1", "2", "3", "4"));

        assertThrows(DegenerateModelRdmException.class,
            () -> new RsaRegression().fit(observed, List.of(truth, everything)));
    }

    @Test
    public void testDescribeIgnoresDefaultLocale() {
        RegressionResult result = new RegressionResult(List.of("Grouped Pairs"), new double[]{0.5}, 0.0, 0.25,
            RegressionMode.OLS);
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertThat(result.describe().get(0)).endsWith("0.5000");
            assertThat(result.toString()).contains("rSquared=0.2500");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
