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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Gaussian base dataset generator.
///
/// For each subject one class signal vector per target is drawn from N(0, classDistance²).
/// Every observation is its target's signal plus N(0, noiseSigma²) noise per feature.
/// Observations are ordered by subject, then run, then repetition, then target.
public class SyntheticDatasetFactory implements BaseDatasetFactory {
    private static final Logger logger = LogManager.getLogger(SyntheticDatasetFactory.class);

    private final double classDistance;

    public SyntheticDatasetFactory() {
        this(1.0);
    }

    /// @param classDistance scale of the per-target signal relative to unit noise
    public SyntheticDatasetFactory(double classDistance) {
        if (classDistance < 0) {
            throw new IllegalArgumentException("classDistance must be non-negative: " + classDistance);
        }
        this.classDistance = classDistance;
    }

    @Override
    public Dataset generate(int nCategories, int nSubjects, int nRuns, int nReps, double noiseSigma,
                            DatasetSize size, UniformRandomProvider rng) {
        requirePositive("nCategories", nCategories);
        requirePositive("nSubjects", nSubjects);
        requirePositive("nRuns", nRuns);
        requirePositive("nReps", nReps);
        if (noiseSigma < 0) {
            throw new IllegalArgumentException("noiseSigma must be non-negative: " + noiseSigma);
        }

        int features = size.getFeatureCount();
        int n = nSubjects * nRuns * nReps * nCategories;
        double[][] samples = new double[n][features];
        int[] targets = new int[n];
        int[] chunks = new int[n];
        int[] subjects = new int[n];
        ContinuousSampler gaussian = RandomGenerators.standardNormal(rng);

        int row = 0;
        for (int subject = 1; subject <= nSubjects; subject++) {
            double[][] signals = new double[nCategories][features];
            for (int t = 0; t < nCategories; t++) {
                for (int f = 0; f < features; f++) {
                    signals[t][f] = classDistance * gaussian.sample();
                }
            }
            for (int run = 1; run <= nRuns; run++) {
                for (int rep = 0; rep < nReps; rep++) {
                    for (int t = 0; t < nCategories; t++) {
                        for (int f = 0; f < features; f++) {
                            samples[row][f] = signals[t][f] + noiseSigma * gaussian.sample();
                        }
                        targets[row] = t + 1;
                        chunks[row] = run;
                        subjects[row] = subject;
                        row++;
                    }
                }
            }
        }

        logger.debug("Generated base dataset: {} observations x {} features ({} categories, {} runs, noise {})",
            n, features, nCategories, nRuns, noiseSigma);
        return new Dataset(samples, targets, chunks, subjects);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
