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

import java.util.List;
import java.util.Locale;

/// A labeled dataset together with the cluster specs that were injected into it.
///
/// @param dataset the frozen, labeled dataset
/// @param schemeName the name of the applied scheme
/// @param appliedSpecs the specs in application order
public record ClusteredDataset(Dataset dataset, String schemeName, List<ClusterSpec> appliedSpecs) {

    public ClusteredDataset {
        appliedSpecs = List.copyOf(appliedSpecs);
    }

    /// @return the cluster report, one block per applied spec
    public String describeClusters() {
        StringBuilder sb = new StringBuilder();
        sb.append("Generated dataset with the following clusters:\n");
        for (int i = 0; i < appliedSpecs.size(); i++) {
            ClusterSpec spec = appliedSpecs.get(i);
            sb.append(String.format("Cluster %d: %s%n", i + 1, spec.description()));
            sb.append(String.format("  Targets: %s%n", spec.targets()));
            sb.append(String.format(Locale.ROOT, "  Sigma Level: %.2f%n", spec.sigmaLevel()));
        }
        return sb.toString();
    }
}
