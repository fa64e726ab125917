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

package io.nosqlbench.rsa.rdm;

import io.nosqlbench.rsa.cluster.ClusterSpec;
import io.nosqlbench.rsa.cluster.ClusteringScheme;

import java.util.List;

/// The hypothesis schemes tested against every simulated ROI.
public final class ModelSchemes {

    public static final ClusteringScheme ANIMATE_INANIMATE = ClusteringScheme.of("Animate vs. Inanimate",
        ClusterSpec.grouping("Animate", 1, 2, 3, 4),
        ClusterSpec.grouping("Inanimate", 5, 6, 7, 8));

    public static final ClusteringScheme GROUPED_PAIRS = ClusteringScheme.of("Grouped Pairs",
        ClusterSpec.grouping("Humans", 1, 2),
        ClusterSpec.grouping("Animals", 3, 4),
        ClusterSpec.grouping("Natural Objects", 5, 6),
        ClusterSpec.grouping("Artificial Objects", 7, 8));

    public static final ClusteringScheme ROUND_SPIKY = ClusteringScheme.of("Round vs. Spiky",
        ClusterSpec.grouping("Even Categories", 2, 4, 6, 8),
        ClusterSpec.grouping("Odd Categories", 1, 3, 5, 7));

    private ModelSchemes() {
    }

    public static List<ClusteringScheme> defaults() {
        return List.of(ANIMATE_INANIMATE, GROUPED_PAIRS, ROUND_SPIKY);
    }
}
