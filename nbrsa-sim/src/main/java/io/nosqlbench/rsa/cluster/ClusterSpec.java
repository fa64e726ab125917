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

import io.nosqlbench.rsa.exceptions.InvalidClusterSpecException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/// A set of target ids which should share representational structure, the strength of
/// that sharing, and a description.
///
/// When used only as a grouping inside a model scheme, the strength is ignored.
///
/// @param targets target ids, non-empty, iterated in ascending order
/// @param sigmaLevel similarity strength in `[0, 1]`
/// @param description a human-readable name for the cluster
public record ClusterSpec(Set<Integer> targets, double sigmaLevel, String description) {

    public ClusterSpec {
        if (targets == null || targets.isEmpty()) {
            throw new InvalidClusterSpecException("ClusterSpec", new int[0], "target set must not be empty");
        }
        int[] ids = targets.stream().mapToInt(Integer::intValue).sorted().toArray();
        if (ids[0] < 1) {
            throw new InvalidClusterSpecException("ClusterSpec", ids, "target ids start at 1");
        }
        if (!(sigmaLevel >= 0.0 && sigmaLevel <= 1.0)) {
            throw new InvalidClusterSpecException("ClusterSpec", ids,
                "sigma level " + sigmaLevel + " is outside [0, 1]");
        }
        targets = Collections.unmodifiableSet(new TreeSet<>(targets));
        description = description == null ? "" : description;
    }

    /// @param description cluster name
    /// @param sigmaLevel similarity strength in `[0, 1]`
    /// @param targets target ids
    /// @return a new spec
    public static ClusterSpec of(String description, double sigmaLevel, int... targets) {
        return new ClusterSpec(Arrays.stream(targets).boxed().collect(Collectors.toSet()), sigmaLevel, description);
    }

    /// A cluster used purely as a same-category grouping in a model scheme.
    public static ClusterSpec grouping(String description, int... targets) {
        return of(description, 0.0, targets);
    }

    /// @return target ids in ascending order
    public int[] targetArray() {
        return targets.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s %s sigma=%.2f", description, targets, sigmaLevel);
    }
}
