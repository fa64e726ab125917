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

import io.nosqlbench.rsa.dataset.Dataset;
import io.nosqlbench.rsa.exceptions.DimensionMismatchException;
import io.nosqlbench.rsa.exceptions.EmptyCategoryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Averages a dataset per category and measures the dissimilarity between the category
/// means.
public class ObservedRdmBuilder {
    private static final Logger logger = LogManager.getLogger(ObservedRdmBuilder.class);

    private final DistanceMetric metric;
    private final boolean centerData;

    /// Correlation distance on centered data.
    public ObservedRdmBuilder() {
        this(DistanceMetric.CORRELATION, true);
    }

    public ObservedRdmBuilder(DistanceMetric metric, boolean centerData) {
        this.metric = metric;
        this.centerData = centerData;
    }

    /// Builds the RDM over categories `1..C`, where `C` is the largest target id present.
    ///
    /// @param dataset the observations
    /// @return the RDM and its labels
    /// @throws EmptyCategoryException if some id in `1..C` has no observations
    public ObservedRdm build(Dataset dataset) {
        int[] ids = dataset.targetIds();
        if (ids.length == 0) {
            throw new IllegalArgumentException("Dataset has no observations");
        }
        return build(dataset, ids[ids.length - 1]);
    }

    /// @param dataset the observations
    /// @param nCategories the number of categories `C`
    /// @return the `C x C` RDM and its labels
    /// @throws EmptyCategoryException if some id in `1..C` has no observations
    /// @throws DimensionMismatchException if an observation's target id lies beyond `C`
    public ObservedRdm build(Dataset dataset, int nCategories) {
        Dataset means = dataset.meanByTarget(nCategories);
        double[] flat = Dissimilarity.pairwise(means.getSamples(), metric, centerData);
        double[][] matrix = RdmMatrices.squareform(flat);

        List<String> labels = new ArrayList<>(nCategories);
        for (int c = 0; c < nCategories; c++) {
            labels.add(means.getLabel(c).orElse(String.valueOf(c + 1)));
        }
        logger.debug("Built {}x{} observed RDM ({} distance, centered={})", nCategories, nCategories, metric, centerData);
        return new ObservedRdm(matrix, labels);
    }

    public DistanceMetric getMetric() {
        return metric;
    }

    public boolean isCenterData() {
        return centerData;
    }
}
