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

import io.nosqlbench.rsa.exceptions.DegenerateModelRdmException;
import io.nosqlbench.rsa.exceptions.DimensionMismatchException;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.rdm.ObservedRdm;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// # RsaRegression
///
/// Regresses an observed RDM onto a set of model RDMs.
///
/// ## Procedure
/// 1. Check every model has the observed RDM's size
/// 2. Flatten each matrix to its off-diagonal upper triangle
/// 3. For [RegressionMode#RANK], replace values by their ranks
/// 4. Z-score the response and each regressor
/// 5. Fit ordinary least squares with an intercept
///
/// The returned coefficients are the standardized slopes, one per model in input order.
public class RsaRegression {
    private static final Logger logger = LogManager.getLogger(RsaRegression.class);

    private final RegressionMode mode;

    public RsaRegression() {
        this(RegressionMode.OLS);
    }

    public RsaRegression(RegressionMode mode) {
        this.mode = mode;
    }

    /// @param observed the response RDM
    /// @param models the regressor RDMs
    /// @return one coefficient per model
    /// @throws DimensionMismatchException if a model's size differs from the observed RDM's
    /// @throws DegenerateModelRdmException if a model has constant off-diagonal values
    public RegressionResult fit(ObservedRdm observed, List<ModelRdm> models) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one model RDM is required");
        }
        for (ModelRdm model : models) {
            if (model.size() != observed.size()) {
                throw new DimensionMismatchException("RsaRegression",
                    "model '" + model.getDescription() + "'", observed.size(), model.size());
            }
        }

        double[] response = standardize(transform(observed.flatten()));
        if (response == null) {
            throw new IllegalArgumentException("Observed RDM has constant off-diagonal dissimilarity");
        }
        int pairs = response.length;
        if (pairs <= models.size() + 1) {
            throw new IllegalArgumentException(String.format(
                "%d category pairs are too few to fit %d models", pairs, models.size()));
        }

        double[][] design = new double[pairs][models.size()];
        List<String> descriptions = new ArrayList<>(models.size());
        for (int m = 0; m < models.size(); m++) {
            ModelRdm model = models.get(m);
            double[] regressor = standardize(transform(model.flatten()));
            if (regressor == null) {
                throw new DegenerateModelRdmException("RsaRegression", model.getDescription());
            }
            for (int p = 0; p < pairs; p++) {
                design[p][m] = regressor[p];
            }
            descriptions.add(model.getDescription());
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(response, design);
        double[] beta;
        double rSquared;
        try {
            beta = ols.estimateRegressionParameters();
            rSquared = ols.calculateRSquared();
        } catch (SingularMatrixException e) {
            throw new IllegalArgumentException("Model RDMs " + descriptions + " are linearly dependent", e);
        }

        double[] coefficients = new double[models.size()];
        System.arraycopy(beta, 1, coefficients, 0, coefficients.length);
        RegressionResult result = new RegressionResult(descriptions, coefficients, beta[0], rSquared, mode);
        logger.info("RSA regression ({}) over {} pairs: {}", mode, pairs, result.describe());
        return result;
    }

    private double[] transform(double[] values) {
        if (mode == RegressionMode.RANK) {
            return new NaturalRanking(TiesStrategy.AVERAGE).rank(values);
        }
        return values;
    }

    /// @return the z-scored values, or null when they have no variance
    private static double[] standardize(double[] values) {
        double mean = StatUtils.mean(values);
        double sd = new StandardDeviation().evaluate(values);
        if (!(sd > 1e-12)) {
            return null;
        }
        double[] z = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            z[i] = (values[i] - mean) / sd;
        }
        return z;
    }

    public RegressionMode getMode() {
        return mode;
    }
}
