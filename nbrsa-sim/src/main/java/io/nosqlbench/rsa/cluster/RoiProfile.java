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

/// Simulated regions of interest, each resolving to the clustering scheme that encodes its
/// assumed representational geometry.
public enum RoiProfile {

    /// Inferotemporal cortex: categorical similarity. Animate categories cluster, with human
    /// and animal pairs nested inside; natural and artificial objects form their own pairs.
    IT(ClusteringScheme.of("IT categorical",
        ClusterSpec.of("Animate", 0.7, 1, 2, 3, 4),
        ClusterSpec.of("Humans", 0.2, 1, 2),
        ClusterSpec.of("Animals", 0.2, 3, 4),
        ClusterSpec.of("Natural", 0.7, 5, 6),
        ClusterSpec.of("Artificial", 0.6, 7, 8))),

    /// Primary visual cortex: perceptual similarity. Faces and round objects share a
    /// pattern; bodies and spiky objects share another.
    V1(ClusteringScheme.of("V1 perceptual",
        ClusterSpec.of("Round", 0.4, 1, 3, 5, 7),
        ClusterSpec.of("Spiky", 0.4, 2, 4, 6, 8)));

    private final ClusteringScheme scheme;

    RoiProfile(ClusteringScheme scheme) {
        this.scheme = scheme;
    }

    public ClusteringScheme scheme() {
        return scheme;
    }
}
