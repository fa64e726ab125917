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

import io.nosqlbench.rsa.exceptions.UnknownTargetIdException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/// Immutable dictionary from target id to a human-readable category label.
public final class TargetLabels {

    private final Map<Integer, String> labels;

    private TargetLabels(Map<Integer, String> labels) {
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
    }

    /// @param labels target id to label entries
    /// @return an immutable copy of the given mapping
    public static TargetLabels of(Map<Integer, String> labels) {
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("At least one target label is required");
        }
        return new TargetLabels(labels);
    }

    /// The eight visual categories used by the IT and V1 simulations.
    public static TargetLabels standard() {
        Map<Integer, String> labels = new LinkedHashMap<>();
        labels.put(1, "human face");
        labels.put(2, "human body");
        labels.put(3, "animal face");
        labels.put(4, "animal body");
        labels.put(5, "natural round");
        labels.put(6, "natural spiky");
        labels.put(7, "artificial round");
        labels.put(8, "artificial spiky");
        return new TargetLabels(labels);
    }

    /// @param targetId the target id to resolve
    /// @return the label for the id
    /// @throws UnknownTargetIdException if there is no entry for the id
    public String labelFor(int targetId) {
        String label = labels.get(targetId);
        if (label == null) {
            throw new UnknownTargetIdException("labelFor", targetId);
        }
        return label;
    }

    public boolean contains(int targetId) {
        return labels.containsKey(targetId);
    }

    public int size() {
        return labels.size();
    }

    public Map<Integer, String> asMap() {
        return labels;
    }

    @Override
    public String toString() {
        return "TargetLabels" + labels;
    }
}
