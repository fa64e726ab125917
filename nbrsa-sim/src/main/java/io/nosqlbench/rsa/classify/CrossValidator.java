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

import io.nosqlbench.rsa.dataset.Dataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Runs a classifier over each partition and pools the held-out predictions.
public final class CrossValidator {
    private static final Logger logger = LogManager.getLogger(CrossValidator.class);

    private CrossValidator() {
    }

    /// @param dataset the observations
    /// @param classifier the classifier to train per fold
    /// @param partitions folds to evaluate
    /// @return pooled predictions, accuracy and confusion counts
    public static CrossValidationResult crossValidate(Dataset dataset, Classifier classifier,
                                                      List<Partition> partitions) {
        int n = dataset.getObservationCount();
        int[] targets = dataset.getTargets();
        int[] ids = dataset.targetIds();
        int nCategories = ids[ids.length - 1];
        int[] predicted = new int[n];
        boolean[] tested = new boolean[n];

        for (Partition partition : partitions) {
            double[][] train = rows(dataset, partition.trainIndices());
            int[] trainTargets = new int[partition.trainIndices().length];
            for (int i = 0; i < trainTargets.length; i++) {
                trainTargets[i] = targets[partition.trainIndices()[i]];
            }
            double[][] test = rows(dataset, partition.testIndices());
            int[] foldPredictions = classifier.classify(train, trainTargets, test);
            for (int i = 0; i < foldPredictions.length; i++) {
                int index = partition.testIndices()[i];
                predicted[index] = foldPredictions[i];
                tested[index] = true;
            }
        }

        int[][] confusion = new int[nCategories][nCategories];
        int correct = 0;
        int total = 0;
        for (int i = 0; i < n; i++) {
            if (!tested[i]) {
                continue;
            }
            total++;
            if (predicted[i] == targets[i]) {
                correct++;
            }
            confusion[targets[i] - 1][predicted[i] - 1]++;
        }
        double accuracy = total == 0 ? Double.NaN : (double) correct / total;
        CrossValidationResult result = new CrossValidationResult(predicted, accuracy, confusion, 1.0 / ids.length);
        logger.info("Classification accuracy: {}% (chance level: {}%)",
            String.format("%.2f", accuracy * 100), String.format("%.2f", result.chanceLevel() * 100));
        return result;
    }

    private static double[][] rows(Dataset dataset, int[] indices) {
        double[][] rows = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            rows[i] = dataset.getSample(indices[i]);
        }
        return rows;
    }
}
