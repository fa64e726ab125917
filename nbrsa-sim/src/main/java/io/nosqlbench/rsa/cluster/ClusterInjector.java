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

package io.nosqlbench.rsa.cluster;

import io.nosqlbench.rsa.dataset.Dataset;
import io.nosqlbench.rsa.dataset.RandomGenerators;
import io.nosqlbench.rsa.exceptions.InvalidClusterSpecException;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;

/// # ClusterInjector
///
/// Pulls the feature vectors of a chosen set of categories toward a shared random
/// signature pattern, creating representational similarity between them.
///
/// ## Algorithm
/// For strength `s` and `F` features:
/// 1. Permute the feature indices and keep the first `round(s * F)`
/// 2. Draw a pattern of `F` values from N(0, sd²), where sd is the sample standard deviation
///    of the whole current feature matrix, and zero it outside the kept features
/// 3. Replace each affected observation `x` with `(1 - s) * x + s * pattern`
///
/// A strength of 0 leaves the dataset untouched and draws nothing from the generator.
///
/// The permutation always covers all `F` indices and the pattern always has `F` draws, so
/// generator consumption does not depend on `s`. For a given generator state a larger
/// strength therefore selects a superset of the features and the same pattern.
public class ClusterInjector {
    private static final Logger logger = LogManager.getLogger(ClusterInjector.class);

    /// Applies one cluster spec to the dataset in place.
    ///
    /// @param dataset the dataset to modify
    /// @param spec the cluster to inject
    /// @param rng the run's generator
    /// @return the same dataset instance
    /// @throws InvalidClusterSpecException if the spec's targets are out of range or match no observation
    public Dataset apply(Dataset dataset, ClusterSpec spec, UniformRandomProvider rng) {
        return apply(dataset, spec.targets(), spec.sigmaLevel(), rng);
    }

    /// @see #apply(Dataset, ClusterSpec, UniformRandomProvider)
    public Dataset apply(Dataset dataset, Set<Integer> targets, double sigmaLevel, UniformRandomProvider rng) {
        int[] ids = targets.stream().mapToInt(Integer::intValue).sorted().toArray();
        if (ids.length == 0) {
            throw new InvalidClusterSpecException("ClusterInjector", ids, "target set must not be empty");
        }
        int[] present = dataset.targetIds();
        int maxTarget = present.length == 0 ? 0 : present[present.length - 1];
        for (int id : ids) {
            if (id < 1 || id > maxTarget) {
                throw new InvalidClusterSpecException("ClusterInjector", ids,
                    "target id " + id + " is outside 1.." + maxTarget);
            }
        }
        if (!(sigmaLevel >= 0.0 && sigmaLevel <= 1.0)) {
            throw new InvalidClusterSpecException("ClusterInjector", ids,
                "sigma level " + sigmaLevel + " is outside [0, 1]");
        }
        int[] affected = dataset.indicesOf(targets);
        if (affected.length == 0) {
            throw new InvalidClusterSpecException("ClusterInjector", ids,
                "no matching observations found for the specified targets");
        }
        if (sigmaLevel == 0.0) {
            return dataset;
        }

        int featureCount = dataset.getFeatureCount();
        int modified = (int) Math.round(sigmaLevel * featureCount);
        int[] order = RandomGenerators.permutation(featureCount, rng);
        boolean[] selected = new boolean[featureCount];
        for (int i = 0; i < modified; i++) {
            selected[order[i]] = true;
        }

        double magnitude = globalStandardDeviation(dataset);
        ContinuousSampler gaussian = RandomGenerators.standardNormal(rng);
        double[] pattern = new double[featureCount];
        for (int f = 0; f < featureCount; f++) {
            double value = gaussian.sample() * magnitude;
            pattern[f] = selected[f] ? value : 0.0;
        }

        double keep = 1.0 - sigmaLevel;
        for (int index : affected) {
            double[] row = dataset.getSample(index);
            for (int f = 0; f < featureCount; f++) {
                row[f] = keep * row[f] + sigmaLevel * pattern[f];
            }
            dataset.replaceSample(index, row);
        }

        logger.debug("Blended pattern (sd {}) into {} observations of targets {} on {} of {} features at sigma {}",
            magnitude, affected.length, targets, modified, featureCount, sigmaLevel);
        return dataset;
    }

    private static double globalStandardDeviation(Dataset dataset) {
        StandardDeviation sd = new StandardDeviation();
        for (int i = 0; i < dataset.getObservationCount(); i++) {
            sd.incrementAll(dataset.getSample(i));
        }
        double value = sd.getResult();
        return Double.isNaN(value) ? 0.0 : value;
    }
}
