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

/// Produces base datasets with independent per-condition noise, before any cluster
/// structure is injected.
public interface BaseDatasetFactory {

    /// @param nCategories number of target ids, emitted as `1..nCategories`
    /// @param nSubjects number of simulated subjects
    /// @param nRuns number of chunks (runs) per subject
    /// @param nReps number of repetitions of each condition within a run
    /// @param noiseSigma standard deviation of the per-observation noise
    /// @param size feature space size
    /// @param rng the generator to draw from; advanced by this call
    /// @return a new, unlabeled dataset
    Dataset generate(int nCategories, int nSubjects, int nRuns, int nReps, double noiseSigma,
                     DatasetSize size, UniformRandomProvider rng);
}
