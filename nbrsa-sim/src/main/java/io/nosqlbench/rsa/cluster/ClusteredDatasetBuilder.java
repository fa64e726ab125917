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
import io.nosqlbench.rsa.dataset.TargetLabels;
import io.nosqlbench.rsa.exceptions.UnknownTargetIdException;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Applies a clustering scheme to a base dataset, one [ClusterInjector] call per spec in
/// scheme order, then labels and freezes the result.
///
/// The base dataset is copied first and stays reusable.
public class ClusteredDatasetBuilder {
    private static final Logger logger = LogManager.getLogger(ClusteredDatasetBuilder.class);

    private final ClusterInjector injector;
    private final TargetLabels targetLabels;

    public ClusteredDatasetBuilder(TargetLabels targetLabels) {
        this(new ClusterInjector(), targetLabels);
    }

    public ClusteredDatasetBuilder(ClusterInjector injector, TargetLabels targetLabels) {
        this.injector = injector;
        this.targetLabels = targetLabels;
    }

    /// @param base the base dataset, left unmodified
    /// @param scheme specs to inject, in order
    /// @param rng the run's generator, advanced once per non-zero-strength spec
    /// @return the labeled dataset and the applied specs
    /// @throws UnknownTargetIdException if a target id in the dataset has no label
    public ClusteredDataset build(Dataset base, ClusteringScheme scheme, UniformRandomProvider rng) {
        for (int targetId : base.targetIds()) {
            if (!targetLabels.contains(targetId)) {
                throw new UnknownTargetIdException("ClusteredDatasetBuilder", targetId);
            }
        }

        Dataset dataset = base.copy();
        List<ClusterSpec> applied = new ArrayList<>(scheme.clusters().size());
        for (ClusterSpec spec : scheme.clusters()) {
            dataset = injector.apply(dataset, spec, rng);
            applied.add(spec);
        }
        dataset.attachLabels(targetLabels);

        ClusteredDataset result = new ClusteredDataset(dataset, scheme.name(), applied);
        logger.info("Applied scheme '{}' to {}\n{}", scheme.name(), dataset, result.describeClusters());
        return result;
    }
}
