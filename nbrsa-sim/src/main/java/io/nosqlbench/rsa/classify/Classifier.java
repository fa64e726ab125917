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

/// Trains on labeled samples and predicts targets for test samples in one call.
public interface Classifier {

    /// @param trainSamples training observations, one row each
    /// @param trainTargets target id per training row
    /// @param testSamples observations to classify
    /// @return the predicted target id per test row
    int[] classify(double[][] trainSamples, int[] trainTargets, double[][] testSamples);
}
