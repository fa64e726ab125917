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

import io.nosqlbench.rsa.classify.Classifier;
import io.nosqlbench.rsa.classify.CrossValidationResult;
import io.nosqlbench.rsa.classify.CrossValidator;
import io.nosqlbench.rsa.classify.LdaClassifier;
import io.nosqlbench.rsa.classify.NFoldPartitioner;
import io.nosqlbench.rsa.cluster.ClusteredDataset;
import io.nosqlbench.rsa.cluster.ClusteredDatasetBuilder;
import io.nosqlbench.rsa.cluster.ClusteringScheme;
import io.nosqlbench.rsa.dataset.BaseDatasetFactory;
import io.nosqlbench.rsa.dataset.Dataset;
import io.nosqlbench.rsa.dataset.RandomGenerators;
import io.nosqlbench.rsa.dataset.SyntheticDatasetFactory;
import io.nosqlbench.rsa.dataset.TargetLabels;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.rdm.ModelRdmGenerator;
import io.nosqlbench.rsa.rdm.ModelSchemes;
import io.nosqlbench.rsa.rdm.ObservedRdm;
import io.nosqlbench.rsa.rdm.ObservedRdmBuilder;
import io.nosqlbench.rsa.regression.RegressionResult;
import io.nosqlbench.rsa.regression.RsaRegression;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// # RsaPipeline
///
/// One end-to-end simulation and analysis run.
///
/// ## Steps
/// 1. Seed a generator from the config
/// 2. Generate the base dataset
/// 3. Inject the ROI's clustering scheme and label the result
/// 4. Decode categories with leave-one-run-out LDA
/// 5. Build the observed RDM from per-category means
/// 6. Build model RDMs from the hypothesis schemes
/// 7. Regress the observed RDM onto the models
///
/// Runs are deterministic for a fixed config. The generator is created inside [#run] and
/// never shared, so separate runs may execute concurrently.
public class RsaPipeline {
    private static final Logger logger = LogManager.getLogger(RsaPipeline.class);

    private final BaseDatasetFactory datasetFactory;
    private final TargetLabels targetLabels;
    private final List<ClusteringScheme> modelSchemes;
    private final Classifier classifier;

    public RsaPipeline() {
        this(new SyntheticDatasetFactory(), TargetLabels.standard(), ModelSchemes.defaults(), new LdaClassifier());
    }

    public RsaPipeline(BaseDatasetFactory datasetFactory, TargetLabels targetLabels,
                       List<ClusteringScheme> modelSchemes, Classifier classifier) {
        this.datasetFactory = datasetFactory;
        this.targetLabels = targetLabels;
        this.modelSchemes = List.copyOf(modelSchemes);
        this.classifier = classifier;
    }

    public RsaAnalysisResult run(SimulationConfig config) {
        RestorableUniformRandomProvider rng = RandomGenerators.create(config.seed());
        ClusteringScheme scheme = config.roi().scheme();

        Dataset base = datasetFactory.generate(config.nCategories(), config.nSubjects(), config.nRuns(),
            config.nReps(), config.noiseSigma(), config.size(), rng);
        logger.info("Generated base dataset for ROI {}: {}", config.roi(), base);

        ClusteredDataset clustered = new ClusteredDatasetBuilder(targetLabels).build(base, scheme, rng);
        Dataset dataset = clustered.dataset();

        CrossValidationResult decoding = null;
        if (config.nRuns() > 1) {
            decoding = CrossValidator.crossValidate(dataset, classifier, NFoldPartitioner.byChunk(dataset));
        } else {
            logger.warn("Skipping decoding, a single run cannot be cross-validated");
        }

        ObservedRdm observed = new ObservedRdmBuilder(config.metric(), config.centerData())
            .build(dataset, config.nCategories());
        List<ModelRdm> models = new ModelRdmGenerator().generate(config.nCategories(), modelSchemes);
        RegressionResult regression = new RsaRegression(config.regression()).fit(observed, models);
        logger.info("Best model for ROI {}: {}", config.roi(), regression.bestModel());

        return new RsaAnalysisResult(config, clustered, decoding, observed, models, regression);
    }
}
