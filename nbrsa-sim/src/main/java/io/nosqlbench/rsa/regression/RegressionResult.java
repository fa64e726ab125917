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

package io.nosqlbench.rsa.regression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/// Standardized regression coefficients, one per model RDM, in model order.
///
/// Coefficients describe a linear decomposition of the observed dissimilarities onto the
/// supplied models. Because model RDMs encode dissimilarity, a positive coefficient means
/// the observed structure follows that model.
public final class RegressionResult {

    private final List<String> modelDescriptions;
    private final double[] coefficients;
    private final double intercept;
    private final double rSquared;
    private final RegressionMode mode;

    public RegressionResult(List<String> modelDescriptions, double[] coefficients, double intercept,
                            double rSquared, RegressionMode mode) {
        if (modelDescriptions.size() != coefficients.length) {
            throw new IllegalArgumentException("Expected " + modelDescriptions.size()
                + " coefficients, got " + coefficients.length);
        }
        this.modelDescriptions = List.copyOf(modelDescriptions);
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.mode = mode;
    }

    public List<String> getModelDescriptions() {
        return modelDescriptions;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getCoefficient(int modelIndex) {
        return coefficients[modelIndex];
    }

    /// @param description a model description
    /// @return the coefficient of the first model with that description
    /// @throws NoSuchElementException if no model has the description
    public double coefficientFor(String description) {
        int index = modelDescriptions.indexOf(description);
        if (index < 0) {
            throw new NoSuchElementException("No model named '" + description + "'");
        }
        return coefficients[index];
    }

    /// @return the description of the model with the largest coefficient
    public String bestModel() {
        int best = 0;
        for (int i = 1; i < coefficients.length; i++) {
            if (coefficients[i] > coefficients[best]) {
                best = i;
            }
        }
        return modelDescriptions.get(best);
    }

    /// @return description and coefficient pairs in model order
    public List<String> describe() {
        List<String> lines = new ArrayList<>(coefficients.length);
        for (int i = 0; i < coefficients.length; i++) {
            lines.add(String.format(Locale.ROOT, "%-24s %8.4f", modelDescriptions.get(i), coefficients[i]));
        }
        return lines;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    public RegressionMode getMode() {
        return mode;
    }

    @Override
    public String toString() {
        return "RegressionResult{mode=" + mode + ", models=" + modelDescriptions
            + ", rSquared=" + String.format(Locale.ROOT, "%.4f", rSquared) + "}";
    }
}
