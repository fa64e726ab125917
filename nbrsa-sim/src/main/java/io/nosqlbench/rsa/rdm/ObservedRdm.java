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

import java.util.List;

/// Empirical dissimilarities between condition-averaged patterns, with the category labels
/// in row and column order.
public final class ObservedRdm {

    private final double[][] matrix;
    private final List<String> labels;

    public ObservedRdm(double[][] matrix, List<String> labels) {
        if (labels.size() != matrix.length) {
            throw new IllegalArgumentException("Expected " + matrix.length + " labels, got " + labels.size());
        }
        this.matrix = RdmMatrices.copy(matrix);
        this.labels = List.copyOf(labels);
    }

    public double[][] getMatrix() {
        return RdmMatrices.copy(matrix);
    }

    public double get(int row, int column) {
        return matrix[row][column];
    }

    public int size() {
        return matrix.length;
    }

    public List<String> getLabels() {
        return labels;
    }

    public double[] flatten() {
        return RdmMatrices.upperTriangle(matrix);
    }
}
