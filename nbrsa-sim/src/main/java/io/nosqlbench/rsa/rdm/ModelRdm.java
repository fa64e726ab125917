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

import java.util.List;

/// An idealized dissimilarity matrix predicted by one clustering scheme: 0 between
/// categories that share a cluster, 2 otherwise, and 0 on the diagonal.
public final class ModelRdm {

    private final String description;
    private final double[][] matrix;
    private final List<ClusterSpec> clusters;

    public ModelRdm(String description, double[][] matrix, List<ClusterSpec> clusters) {
        this.description = description;
        this.matrix = RdmMatrices.copy(matrix);
        this.clusters = List.copyOf(clusters);
    }

    public String getDescription() {
        return description;
    }

    /// @return a copy of the square matrix
    public double[][] getMatrix() {
        return RdmMatrices.copy(matrix);
    }

    public double get(int row, int column) {
        return matrix[row][column];
    }

    public int size() {
        return matrix.length;
    }

    public List<ClusterSpec> getClusters() {
        return clusters;
    }

    /// @return the off-diagonal upper triangle
    public double[] flatten() {
        return RdmMatrices.upperTriangle(matrix);
    }

    @Override
    public String toString() {
        return "ModelRdm{" + description + ", " + matrix.length + "x" + matrix.length + ", clusters=" + clusters.size() + "}";
    }
}
