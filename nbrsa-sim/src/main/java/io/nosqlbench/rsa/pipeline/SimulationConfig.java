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
import io.nosqlbench.rsa.rdm.DistanceMetric;
import io.nosqlbench.rsa.regression.RegressionMode;

/// Parameters of one simulation and analysis run.
///
/// @param nCategories number of categories `C`
/// @param nSubjects number of simulated subjects
/// @param nRuns number of runs (chunks); also the number of decoding folds
/// @param nReps repetitions of each condition per run
/// @param noiseSigma per-observation noise standard deviation
/// @param seed generator seed
/// @param size feature space size
/// @param roi simulated region, selecting the injected clustering scheme
/// @param metric dissimilarity measure for the observed RDM
/// @param centerData whether category means are centered before measuring dissimilarity
/// @param regression regression mode for model comparison
public record SimulationConfig(
    int nCategories,
    int nSubjects,
    int nRuns,
    int nReps,
    double noiseSigma,
    long seed,
    DatasetSize size,
    RoiProfile roi,
    DistanceMetric metric,
    boolean centerData,
    RegressionMode regression
) {

    public SimulationConfig {
        if (nCategories < 2) {
            throw new IllegalArgumentException("nCategories must be at least 2: " + nCategories);
        }
        if (nSubjects < 1 || nRuns < 1 || nReps < 1) {
            throw new IllegalArgumentException(String.format(
                "nSubjects, nRuns and nReps must be positive: %d, %d, %d", nSubjects, nRuns, nReps));
        }
        if (noiseSigma < 0) {
            throw new IllegalArgumentException("noiseSigma must be non-negative: " + noiseSigma);
        }
        if (size == null || roi == null || metric == null || regression == null) {
            throw new IllegalArgumentException("size, roi, metric and regression are required");
        }
    }

    /// Eight categories, ten runs, one subject, one repetition, noise 0.6, seed 42, normal
    /// size, IT profile, centered correlation distance, OLS.
    public static SimulationConfig defaults() {
        return new SimulationConfig(8, 1, 10, 1, 0.6, 42L, DatasetSize.NORMAL, RoiProfile.IT,
            DistanceMetric.CORRELATION, true, RegressionMode.OLS);
    }

    public SimulationConfig withRoi(RoiProfile roi) {
        return new SimulationConfig(nCategories, nSubjects, nRuns, nReps, noiseSigma, seed, size, roi, metric,
            centerData, regression);
    }

    public SimulationConfig withSeed(long seed) {
        return new SimulationConfig(nCategories, nSubjects, nRuns, nReps, noiseSigma, seed, size, roi, metric,
            centerData, regression);
    }

    public SimulationConfig withSize(DatasetSize size) {
        return new SimulationConfig(nCategories, nSubjects, nRuns, nReps, noiseSigma, seed, size, roi, metric,
            centerData, regression);
    }

    public SimulationConfig withNoiseSigma(double noiseSigma) {
        return new SimulationConfig(nCategories, nSubjects, nRuns, nReps, noiseSigma, seed, size, roi, metric,
            centerData, regression);
    }

    public SimulationConfig withRegression(RegressionMode regression) {
        return new SimulationConfig(nCategories, nSubjects, nRuns, nReps, noiseSigma, seed, size, roi, metric,
            centerData, regression);
    }
}
