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

package io.nosqlbench.rsa.classify;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;

/// Linear discriminant analysis with a shared, regularized covariance and equal priors.
///
/// The pooled within-class covariance gets `regularization * mean(diag)` added to its
/// diagonal so that it stays invertible when features outnumber observations.
public class LdaClassifier implements Classifier {

    public static final double DEFAULT_REGULARIZATION = 0.01;

    private final double regularization;

    public LdaClassifier() {
        this(DEFAULT_REGULARIZATION);
    }

    public LdaClassifier(double regularization) {
        if (regularization < 0) {
            throw new IllegalArgumentException("regularization must be non-negative: " + regularization);
        }
        this.regularization = regularization;
    }

    @Override
    public int[] classify(double[][] trainSamples, int[] trainTargets, double[][] testSamples) {
        if (trainSamples.length == 0 || trainSamples.length != trainTargets.length) {
            throw new IllegalArgumentException("Training samples and targets must be non-empty and of equal length");
        }
        int features = trainSamples[0].length;
        int[] classes = Arrays.stream(trainTargets).distinct().sorted().toArray();
        int k = classes.length;

        double[][] means = new double[k][features];
        int[] counts = new int[k];
        int[] slotOf = new int[trainTargets.length];
        for (int i = 0; i < trainSamples.length; i++) {
            int slot = Arrays.binarySearch(classes, trainTargets[i]);
            slotOf[i] = slot;
            counts[slot]++;
            for (int f = 0; f < features; f++) {
                means[slot][f] += trainSamples[i][f];
            }
        }
        for (int c = 0; c < k; c++) {
            for (int f = 0; f < features; f++) {
                means[c][f] /= counts[c];
            }
        }

        double[][] covariance = new double[features][features];
        for (int i = 0; i < trainSamples.length; i++) {
            double[] mu = means[slotOf[i]];
            for (int a = 0; a < features; a++) {
                double da = trainSamples[i][a] - mu[a];
                for (int b = a; b < features; b++) {
                    covariance[a][b] += da * (trainSamples[i][b] - mu[b]);
                }
            }
        }
        int dof = Math.max(1, trainSamples.length - k);
        double diagonalSum = 0.0;
        for (int a = 0; a < features; a++) {
            for (int b = a; b < features; b++) {
                covariance[a][b] /= dof;
                covariance[b][a] = covariance[a][b];
            }
            diagonalSum += covariance[a][a];
        }
        double ridge = regularization * diagonalSum / features;
        if (!(ridge > 0)) {
            ridge = 1e-10;
        }
        for (int a = 0; a < features; a++) {
            covariance[a][a] += ridge;
        }

        RealMatrix inverse = new LUDecomposition(new Array2DRowRealMatrix(covariance, false)).getSolver().getInverse();
        double[][] weights = new double[k][];
        double[] offsets = new double[k];
        for (int c = 0; c < k; c++) {
            weights[c] = inverse.operate(means[c]);
            offsets[c] = -0.5 * dot(means[c], weights[c]);
        }

        int[] predicted = new int[testSamples.length];
        for (int t = 0; t < testSamples.length; t++) {
            int best = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                double score = dot(testSamples[t], weights[c]) + offsets[c];
                if (score > bestScore) {
                    bestScore = score;
                    best = c;
                }
            }
            predicted[t] = classes[best];
        }
        return predicted;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
