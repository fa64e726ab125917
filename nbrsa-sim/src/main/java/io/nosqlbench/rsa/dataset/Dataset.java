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

import io.nosqlbench.rsa.exceptions.DimensionMismatchException;
import io.nosqlbench.rsa.exceptions.EmptyCategoryException;
import io.nosqlbench.rsa.exceptions.UnknownTargetIdException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// # Dataset
///
/// An ordered table of observations. Each observation has a feature vector of fixed
/// dimensionality, a target (category) id, a chunk (run) id and a subject id, and once
/// labeled, a human-readable category label.
///
/// ## Lifecycle
/// 1. Created by a [BaseDatasetFactory]
/// 2. Feature values mutated in place by cluster injection
/// 3. Frozen by [#attachLabels(TargetLabels)]; further mutation is rejected
///
/// Target ids, chunk ids, subject ids and the feature count never change.
public class Dataset {

    private final double[][] samples;
    private final int[] targets;
    private final int[] chunks;
    private final int[] subjects;
    private final int featureCount;
    private String[] labels;

    /// @param samples observation by feature values, rows are copied
    /// @param targets target id per observation
    /// @param chunks chunk (run) id per observation
    /// @param subjects subject id per observation
    public Dataset(double[][] samples, int[] targets, int[] chunks, int[] subjects) {
        int n = samples.length;
        if (targets.length != n || chunks.length != n || subjects.length != n) {
            throw new IllegalArgumentException(String.format(
                "Attribute lengths (targets=%d, chunks=%d, subjects=%d) must match observation count %d",
                targets.length, chunks.length, subjects.length, n));
        }
        this.featureCount = n == 0 ? 0 : samples[0].length;
        this.samples = new double[n][];
        for (int i = 0; i < n; i++) {
            if (samples[i].length != featureCount) {
                throw new DimensionMismatchException("Dataset", "feature vector " + i, featureCount, samples[i].length);
            }
            this.samples[i] = samples[i].clone();
        }
        this.targets = targets.clone();
        this.chunks = chunks.clone();
        this.subjects = subjects.clone();
    }

    public int getObservationCount() {
        return samples.length;
    }

    public int getFeatureCount() {
        return featureCount;
    }

    /// @param index observation index
    /// @return a copy of the feature vector
    public double[] getSample(int index) {
        return samples[index].clone();
    }

    /// @return a deep copy of the sample matrix
    public double[][] getSamples() {
        double[][] copy = new double[samples.length][];
        for (int i = 0; i < samples.length; i++) {
            copy[i] = samples[i].clone();
        }
        return copy;
    }

    public int getTarget(int index) {
        return targets[index];
    }

    public int[] getTargets() {
        return targets.clone();
    }

    public int getChunk(int index) {
        return chunks[index];
    }

    public int[] getChunks() {
        return chunks.clone();
    }

    public int[] getSubjects() {
        return subjects.clone();
    }

    /// @param index observation index
    /// @return the category label, or empty if labels have not been attached
    public Optional<String> getLabel(int index) {
        return labels == null ? Optional.empty() : Optional.of(labels[index]);
    }

    /// @return labels in observation order, or an empty list if not labeled
    public List<String> getLabels() {
        return labels == null ? Collections.emptyList() : List.of(labels);
    }

    public boolean isFrozen() {
        return labels != null;
    }

    /// @return the sorted distinct target ids present
    public int[] targetIds() {
        return Arrays.stream(targets).distinct().sorted().toArray();
    }

    /// @return the number of distinct target ids
    public int categoryCount() {
        return targetIds().length;
    }

    /// @param targetSet target ids to match
    /// @return indices of observations whose target id is in the set
    public int[] indicesOf(Set<Integer> targetSet) {
        int[] matches = new int[targets.length];
        int count = 0;
        for (int i = 0; i < targets.length; i++) {
            if (targetSet.contains(targets[i])) {
                matches[count++] = i;
            }
        }
        return Arrays.copyOf(matches, count);
    }

    /// Replaces the feature vector of one observation.
    ///
    /// @param index observation index
    /// @param values new feature values, copied
    /// @throws IllegalStateException if the dataset has been frozen by labeling
    public void replaceSample(int index, double[] values) {
        if (isFrozen()) {
            throw new IllegalStateException("Dataset is frozen once labels are attached");
        }
        if (values.length != featureCount) {
            throw new DimensionMismatchException("replaceSample", "feature vector " + index, featureCount, values.length);
        }
        samples[index] = values.clone();
    }

    /// Attaches a label to every observation by mapping its target id, then freezes the
    /// feature values.
    ///
    /// @param targetLabels the target to label dictionary
    /// @throws UnknownTargetIdException if any target id has no entry
    public void attachLabels(TargetLabels targetLabels) {
        if (isFrozen()) {
            throw new IllegalStateException("Labels have already been attached");
        }
        for (int targetId : targetIds()) {
            if (!targetLabels.contains(targetId)) {
                throw new UnknownTargetIdException("attachLabels", targetId);
            }
        }
        String[] resolved = new String[targets.length];
        for (int i = 0; i < targets.length; i++) {
            resolved[i] = targetLabels.labelFor(targets[i]);
        }
        this.labels = resolved;
    }

    /// Averages observations sharing a target id. The result holds one row per target id
    /// `1..nCategories`, in id order, with chunk and subject ids set to 0. Labels carry over
    /// when present.
    ///
    /// @param nCategories the number of categories expected
    /// @return a new dataset of per-category means, frozen if labels carried over
    /// @throws EmptyCategoryException if a category has no observations
    /// @throws DimensionMismatchException if an observation's target id lies outside `1..nCategories`
    public Dataset meanByTarget(int nCategories) {
        int[] ids = targetIds();
        if (ids.length > 0 && (ids[0] < 1 || ids[ids.length - 1] > nCategories)) {
            int outlier = ids[0] < 1 ? ids[0] : ids[ids.length - 1];
            throw new DimensionMismatchException("meanByTarget",
                "category range holding target id " + outlier, nCategories, outlier);
        }
        double[][] sums = new double[nCategories][featureCount];
        int[] counts = new int[nCategories];
        String[] meanLabels = new String[nCategories];
        for (int i = 0; i < samples.length; i++) {
            int slot = targets[i] - 1;
            counts[slot]++;
            for (int f = 0; f < featureCount; f++) {
                sums[slot][f] += samples[i][f];
            }
            if (labels != null) {
                meanLabels[slot] = labels[i];
            }
        }
        for (int c = 0; c < nCategories; c++) {
            if (counts[c] == 0) {
                throw new EmptyCategoryException("meanByTarget", c + 1);
            }
            for (int f = 0; f < featureCount; f++) {
                sums[c][f] /= counts[c];
            }
        }
        int[] meanTargets = new int[nCategories];
        for (int c = 0; c < nCategories; c++) {
            meanTargets[c] = c + 1;
        }
        Dataset means = new Dataset(sums, meanTargets, new int[nCategories], new int[nCategories]);
        if (labels != null) {
            means.labels = meanLabels;
        }
        return means;
    }

    /// @return an unlabeled, mutable deep copy with the same attributes
    public Dataset copy() {
        return new Dataset(samples, targets, chunks, subjects);
    }

    @Override
    public String toString() {
        return String.format("Dataset{observations=%d, features=%d, categories=%d, labeled=%s}",
            samples.length, featureCount, categoryCount(), isFrozen());
    }
}
