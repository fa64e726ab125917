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

package io.nosqlbench.rsa.pipeline;

import io.nosqlbench.rsa.classify.CrossValidationResult;
import io.nosqlbench.rsa.cluster.ClusteredDataset;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.rdm.ObservedRdm;
import io.nosqlbench.rsa.regression.RegressionResult;

import java.util.List;

/// Everything one pipeline run produces, for presentation by callers.
public record RsaAnalysisResult(
    SimulationConfig config,
    ClusteredDataset clustered,
    CrossValidationResult decoding,
    ObservedRdm observedRdm,
    List<ModelRdm> modelRdms,
    RegressionResult regression
) {
    public RsaAnalysisResult {
        modelRdms = List.copyOf(modelRdms);
    }
}
