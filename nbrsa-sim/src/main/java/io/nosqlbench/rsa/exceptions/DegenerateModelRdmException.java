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

package io.nosqlbench.rsa.exceptions;

/// Thrown when a model RDM predicts the same dissimilarity for every pair of categories.
/// Such a model carries no structure and cannot be standardized as a regressor.
public class DegenerateModelRdmException extends RsaPipelineException {

    private final String modelDescription;

    public DegenerateModelRdmException(String operation, String modelDescription) {
        super(operation, "model '" + modelDescription + "' has constant off-diagonal dissimilarity");
        this.modelDescription = modelDescription;
    }

    public String getModelDescription() {
        return modelDescription;
    }
}
