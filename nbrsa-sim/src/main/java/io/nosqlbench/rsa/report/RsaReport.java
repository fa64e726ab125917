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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.rsa.cluster.ClusterSpec;
import io.nosqlbench.rsa.pipeline.RsaAnalysisResult;
import io.nosqlbench.rsa.rdm.ModelRdm;

import java.util.ArrayList;
import java.util.List;

/// Serializable view of an [RsaAnalysisResult] without the raw observation table.
public final class RsaReport {

    @SerializedName("roi")
    String roi;
    @SerializedName("seed")
    long seed;
    @SerializedName("scheme")
    String scheme;
    @SerializedName("clusters")
    List<Cluster> clusters = new ArrayList<>();
    @SerializedName("labels")
    List<String> labels;
    @SerializedName("accuracy")
    Double accuracy;
    @SerializedName("chance_level")
    Double chanceLevel;
    @SerializedName("confusion")
    int[][] confusion;
    @SerializedName("observed_rdm")
    double[][] observedRdm;
    @SerializedName("models")
    List<Model> models = new ArrayList<>();
    @SerializedName("regression_mode")
    String regressionMode;
    @SerializedName("r_squared")
    double rSquared;

    static final class Cluster {
        @SerializedName("description")
        String description;
        @SerializedName("targets")
        int[] targets;
        @SerializedName("sigma_level")
        double sigmaLevel;
    }

    static final class Model {
        @SerializedName("description")
        String description;
        @SerializedName("rdm")
        double[][] rdm;
        @SerializedName("coefficient")
        double coefficient;
    }

    private RsaReport() {
    }

    public static RsaReport from(RsaAnalysisResult result) {
        RsaReport report = new RsaReport();
        report.roi = result.config().roi().name();
        report.seed = result.config().seed();
        report.scheme = result.clustered().schemeName();
        for (ClusterSpec spec : result.clustered().appliedSpecs()) {
            Cluster cluster = new Cluster();
            cluster.description = spec.description();
            cluster.targets = spec.targetArray();
            cluster.sigmaLevel = spec.sigmaLevel();
            report.clusters.add(cluster);
        }
        report.labels = result.observedRdm().getLabels();
        if (result.decoding() != null) {
            report.accuracy = result.decoding().accuracy();
            report.chanceLevel = result.decoding().chanceLevel();
            report.confusion = result.decoding().confusion();
        }
        report.observedRdm = result.observedRdm().getMatrix();
        for (int i = 0; i < result.modelRdms().size(); i++) {
            ModelRdm modelRdm = result.modelRdms().get(i);
            Model model = new Model();
            model.description = modelRdm.getDescription();
            model.rdm = modelRdm.getMatrix();
            model.coefficient = result.regression().getCoefficient(i);
            report.models.add(model);
        }
        report.regressionMode = result.regression().getMode().name();
        report.rSquared = result.regression().getRSquared();
        return report;
    }

    public String toJson() {
        return RsaGsonConfig.gson().toJson(this);
    }

    public String getRoi() {
        return roi;
    }

    public List<String> getLabels() {
        return labels;
    }
}
