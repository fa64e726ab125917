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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random number generators for the simulation pipeline.
 * A single provider is created per run and handed explicitly to every
 * consumer, so that results are reproducible for a fixed seed and call order.
 */
public final class RandomGenerators {

    private RandomGenerators() {
    }

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiro256++, 256-bit state. The default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64, 64-bit state.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, the generator family used by most numeric environments.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm.
     *
     * @param seed The seed for deterministic random generation
     * @return A restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates a standard normal sampler backed by the given generator.
     *
     * @param rng The random number generator
     * @return a sampler of N(0,1) values
     */
    public static ContinuousSampler standardNormal(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }

    /**
     * Returns a uniformly random permutation of {@code 0..n-1}.
     * The generator state consumed depends only on {@code n} and the drawn values, never on
     * how many leading entries the caller later uses.
     *
     * @param n The permutation size
     * @param rng The random number generator
     * @return a shuffled index array
     */
    public static int[] permutation(int n, UniformRandomProvider rng) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        shuffle(indices, rng);
        return indices;
    }

    /**
     * Shuffles an array in-place using the Fisher-Yates algorithm.
     *
     * @param values The array to shuffle
     * @param rng The random number generator
     */
    public static void shuffle(int[] values, UniformRandomProvider rng) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int temp = values[i];
            values[i] = values[j];
            values[j] = temp;
        }
    }
}
