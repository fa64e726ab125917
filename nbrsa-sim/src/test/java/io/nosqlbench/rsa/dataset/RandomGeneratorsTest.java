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

package io.nosqlbench.rsa.dataset;

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class RandomGeneratorsTest {

    @Test
    void testCreateDefaultAlgorithm() {
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(54321L);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, 54321L);

        assertEquals(rng1.nextLong(), rng2.nextLong());
        assertEquals(rng1.nextLong(), rng2.nextLong());
    }

    @Test
    void testDifferentAlgorithmsDiffer() {
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, 7L);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.SPLIT_MIX_64, 7L);
        assertNotEquals(rng1.nextLong(), rng2.nextLong());
    }

    @Test
    void testPermutationCoversAllIndices() {
        int[] permutation = RandomGenerators.permutation(50, RandomGenerators.create(3L));
        int[] sorted = permutation.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < 50; i++) {
            assertEquals(i, sorted[i]);
        }
        assertThat(permutation).isNotEqualTo(sorted);
    }

    @Test
    void testPermutationIsReproducible() {
        assertThat(RandomGenerators.permutation(30, RandomGenerators.create(11L)))
            .isEqualTo(RandomGenerators.permutation(30, RandomGenerators.create(11L)));
    }

    @Test
    void testSaveAndRestoreStateAroundPermutation() {
        RestorableUniformRandomProvider rng = RandomGenerators.create(42L);
        RandomProviderState state = rng.saveState();
        int[] first = RandomGenerators.permutation(20, rng);
        rng.restoreState(state);
        int[] second = RandomGenerators.permutation(20, rng);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void testStandardNormalMoments() {
        ContinuousSampler sampler = RandomGenerators.standardNormal(RandomGenerators.create(303L));
        int n = 20000;
        double sum = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double v = sampler.sample();
            sum += v;
            sumSq += v * v;
        }
        double mean = sum / n;
        double variance = sumSq / n - mean * mean;
        assertThat(mean).isCloseTo(0.0, within(0.05));
        assertThat(variance).isCloseTo(1.0, within(0.05));
    }
}
