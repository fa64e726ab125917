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

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/// Pairwise dissimilarity measures between condition patterns.
public enum DistanceMetric {

    /// `1 - r`, with `r` the Pearson correlation of the two patterns. Ranges over `[0, 2]`.
    CORRELATION {
        @Override
        public double distance(double[] a, double[] b) {
            return 1.0 - new PearsonsCorrelation().correlation(a, b);
        }
    },

    /// Straight-line L2 distance.
    EUCLIDEAN {
        @Override
        public double distance(double[] a, double[] b) {
            double sum = 0.0;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    },

    /// `1 - cos(a, b)`.
    COSINE {
        @Override
        public double distance(double[] a, double[] b) {
            double dot = 0.0;
            double normA = 0.0;
            double normB = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            return 1.0 - dot / Math.sqrt(normA * normB);
        }
    };

    /// @param a first pattern
    /// @param b second pattern, same length as `a`
    /// @return the dissimilarity between them
    public abstract double distance(double[] a, double[] b);
}
