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

import io.nosqlbench.rsa.exceptions.DimensionMismatchException;

/// Pairwise dissimilarity between the rows of a pattern matrix.
public final class Dissimilarity {

    private Dissimilarity() {
        // Utility class
    }

    /// @param rows one pattern per condition
    /// @param metric the distance to apply
    /// @param center when true, subtract from each feature its mean across rows first
    /// @return the flat upper-triangle distance vector, see [RdmMatrices]
    public static double[] pairwise(double[][] rows, DistanceMetric metric, boolean center) {
        int n = rows.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least two patterns are required, got " + n);
        }
        int features = rows[0].length;
        for (int i = 1; i < n; i++) {
            if (rows[i].length != features) {
                throw new DimensionMismatchException("pairwise", "pattern " + i, features, rows[i].length);
            }
        }
        double[][] patterns = center ? centerColumns(rows) : rows;
        double[] flat = new double[RdmMatrices.pairCount(n)];
        int k = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                flat[k++] = metric.distance(patterns[i], patterns[j]);
            }
        }
        return flat;
    }

    static double[][] centerColumns(double[][] rows) {
        int features = rows[0].length;
        double[] means = new double[features];
        for (double[] row : rows) {
            for (int f = 0; f < features; f++) {
                means[f] += row[f];
            }
        }
        for (int f = 0; f < features; f++) {
            means[f] /= rows.length;
        }
        double[][] centered = new double[rows.length][features];
        for (int i = 0; i < rows.length; i++) {
            for (int f = 0; f < features; f++) {
                centered[i][f] = rows[i][f] - means[f];
            }
        }
        return centered;
    }
}
