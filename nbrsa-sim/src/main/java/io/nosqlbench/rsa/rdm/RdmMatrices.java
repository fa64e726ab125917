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

/// Conversions between square dissimilarity matrices and their flat off-diagonal form.
///
/// The flat form lists the strict upper triangle row by row:
/// `(0,1), (0,2), ..., (0,n-1), (1,2), ...`, which for a symmetric matrix is the same
/// sequence as the column-major lower triangle.
public final class RdmMatrices {

    private RdmMatrices() {
        // Utility class
    }

    /// @param n matrix size
    /// @return the number of off-diagonal pairs, `n(n-1)/2`
    public static int pairCount(int n) {
        return n * (n - 1) / 2;
    }

    /// @param matrix a square matrix
    /// @return its strict upper triangle, row by row
    public static double[] upperTriangle(double[][] matrix) {
        int n = matrix.length;
        double[] flat = new double[pairCount(n)];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (matrix[i].length != n) {
                throw new IllegalArgumentException("Matrix must be square, row " + i + " has length " + matrix[i].length);
            }
            for (int j = i + 1; j < n; j++) {
                flat[k++] = matrix[i][j];
            }
        }
        return flat;
    }

    /// Rebuilds a symmetric matrix with zero diagonal from its flat form.
    ///
    /// @param flat the strict upper triangle
    /// @return the square matrix
    public static double[][] squareform(double[] flat) {
        int n = (int) Math.round((1 + Math.sqrt(1 + 8.0 * flat.length)) / 2);
        if (pairCount(n) != flat.length) {
            throw new IllegalArgumentException("Length " + flat.length + " is not a triangular pair count");
        }
        double[][] matrix = new double[n][n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                matrix[i][j] = flat[k];
                matrix[j][i] = flat[k];
                k++;
            }
        }
        return matrix;
    }

    /// @param matrix the matrix to copy
    /// @return a deep copy
    public static double[][] copy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
