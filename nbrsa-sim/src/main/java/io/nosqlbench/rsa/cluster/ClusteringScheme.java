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

import java.util.List;

/// An ordered list of cluster specs that together express one hypothesis about
/// representational organization.
///
/// Order is significant. Later, narrower specs are applied on top of structure injected by
/// earlier, broader ones, which is how nested similarity is produced. Consumers must apply
/// the specs in list order.
///
/// @param name the scheme name
/// @param clusters cluster specs in application order
public record ClusteringScheme(String name, List<ClusterSpec> clusters) {

    public ClusteringScheme {
        if (clusters == null || clusters.isEmpty()) {
            throw new IllegalArgumentException("Clustering scheme '" + name + "' has no clusters");
        }
        clusters = List.copyOf(clusters);
    }

    public static ClusteringScheme of(String name, ClusterSpec... clusters) {
        return new ClusteringScheme(name, List.of(clusters));
    }

    /// @return the largest target id referenced by any cluster
    public int maxTarget() {
        return clusters.stream()
            .flatMap(c -> c.targets().stream())
            .mapToInt(Integer::intValue)
            .max()
            .orElse(0);
    }
}
