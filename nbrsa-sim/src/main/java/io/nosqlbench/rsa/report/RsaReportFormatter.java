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

package io.nosqlbench.rsa.report;

import io.nosqlbench.rsa.classify.CrossValidationResult;
import io.nosqlbench.rsa.dataset.Dataset;
import io.nosqlbench.rsa.pipeline.RsaAnalysisResult;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.regression.RegressionResult;

import java.util.List;
import java.util.Locale;

/// Plain-text rendering of an analysis run.
public final class RsaReportFormatter {

    private RsaReportFormatter() {
        // Utility class
    }

    public static String format(RsaAnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("RSA SIMULATION: ROI ").append(result.config().roi())
            .append(" (seed ").append(result.config().seed()).append(")\n");
        sb.append("==============================\n");
        sb.append(result.clustered().describeClusters()).append('\n');

        sb.append(formatTargetLabels(result.clustered().dataset())).append('\n');

        CrossValidationResult decoding = result.decoding();
        if (decoding != null) {
            sb.append(String.format(Locale.ROOT, "Classification accuracy: %.2f%% (chance level: %.2f%%)%n%n",
                decoding.accuracy() * 100, decoding.chanceLevel() * 100));
        }

        List<String> labels = result.observedRdm().getLabels();
        sb.append("Observed RDM\n");
        sb.append(formatMatrix(result.observedRdm().getMatrix(), labels)).append('\n');
        for (ModelRdm model : result.modelRdms()) {
            sb.append("Model RDM: ").append(model.getDescription()).append('\n');
            sb.append(formatMatrix(model.getMatrix(), labels)).append('\n');
        }

        RegressionResult regression = result.regression();
        sb.append(String.format(Locale.ROOT, "Regression coefficients (%s, R^2=%.4f)%n", regression.getMode(), regression.getRSquared()));
        for (String line : regression.describe()) {
            sb.append("  ").append(line).append('\n');
        }
        return sb.toString();
    }

    /// @return the distinct target to label pairs in first-seen order
    public static String formatTargetLabels(Dataset dataset) {
        StringBuilder sb = new StringBuilder("Target to Label Mapping:\n");
        int[] ids = dataset.targetIds();
        boolean[] seen = new boolean[ids.length == 0 ? 1 : ids[ids.length - 1] + 1];
        for (int i = 0; i < dataset.getObservationCount(); i++) {
            int target = dataset.getTarget(i);
            if (!seen[target]) {
                seen[target] = true;
                sb.append(String.format(Locale.ROOT, "  %2d  %s%n", target, dataset.getLabel(i).orElse("")));
            }
        }
        return sb.toString();
    }

    public static String formatMatrix(double[][] matrix, List<String> labels) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < matrix.length; i++) {
            String label = i < labels.size() ? labels.get(i) : String.valueOf(i + 1);
            sb.append(String.format(Locale.ROOT, "%-18s", label));
            for (double value : matrix[i]) {
                sb.append(String.format(Locale.ROOT, " %6.3f", value));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
