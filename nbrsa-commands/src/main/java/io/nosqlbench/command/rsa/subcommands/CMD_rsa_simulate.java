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

package io.nosqlbench.command.rsa.subcommands;

import io.nosqlbench.rsa.cluster.RoiProfile;
import io.nosqlbench.rsa.dataset.DatasetSize;
import io.nosqlbench.rsa.exceptions.RsaPipelineException;
import io.nosqlbench.rsa.pipeline.RsaAnalysisResult;
import io.nosqlbench.rsa.pipeline.RsaPipeline;
import io.nosqlbench.rsa.pipeline.SimulationConfig;
import io.nosqlbench.rsa.rdm.DistanceMetric;
import io.nosqlbench.rsa.regression.RegressionMode;
import io.nosqlbench.rsa.report.RsaReport;
import io.nosqlbench.rsa.report.RsaReportFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Runs the full pipeline for one simulated ROI and prints the cluster report, decoding
/// accuracy, RDMs and regression coefficients.
@CommandLine.Command(name = "simulate",
    description = "Generate a clustered dataset for an ROI and run decoding and RSA on it")
public class CMD_rsa_simulate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_rsa_simulate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-r", "--roi"},
        description = "Simulated region of interest (${COMPLETION-CANDIDATES})",
        defaultValue = "IT")
    private RoiProfile roi = RoiProfile.IT;

    @CommandLine.Option(names = {"-c", "--categories"},
        description = "Number of categories; the IT and V1 schemes and the standard labels cover exactly 8",
        defaultValue = "8")
    private int categories = 8;

    @CommandLine.Option(names = {"--subjects"}, description = "Number of subjects", defaultValue = "1")
    private int subjects = 1;

    @CommandLine.Option(names = {"--runs"}, description = "Number of runs (chunks)", defaultValue = "10")
    private int runs = 10;

    @CommandLine.Option(names = {"--reps"}, description = "Repetitions per condition and run", defaultValue = "1")
    private int reps = 1;

    @CommandLine.Option(names = {"--sigma"}, description = "Noise standard deviation", defaultValue = "0.6")
    private double sigma = 0.6;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Random seed", defaultValue = "42")
    private long seed = 42L;

    @CommandLine.Option(names = {"--size"},
        description = "Feature space size (${COMPLETION-CANDIDATES})",
        defaultValue = "NORMAL")
    private DatasetSize size = DatasetSize.NORMAL;

    @CommandLine.Option(names = {"-m", "--metric"},
        description = "Dissimilarity measure (${COMPLETION-CANDIDATES})",
        defaultValue = "CORRELATION")
    private DistanceMetric metric = DistanceMetric.CORRELATION;

    @CommandLine.Option(names = {"--no-center"}, description = "Do not center category means before measuring")
    private boolean noCenter = false;

    @CommandLine.Option(names = {"--regression"},
        description = "Regression mode (${COMPLETION-CANDIDATES})",
        defaultValue = "OLS")
    private RegressionMode regression = RegressionMode.OLS;

    @CommandLine.Option(names = {"--json"}, description = "Print the report as JSON")
    private boolean json = false;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log pipeline progress")
    private boolean verbose = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        CMD_rsa_simulate cmd = new CMD_rsa_simulate();
        int exitCode = new CommandLine(cmd).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }

    SimulationConfig toConfig() {
        return new SimulationConfig(categories, subjects, runs, reps, sigma, seed, size, roi, metric, !noCenter,
            regression);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setLevel("io.nosqlbench", Level.INFO);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SimulationConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            RsaAnalysisResult result = new RsaPipeline().run(config);
            if (json) {
                out.println(RsaReport.from(result).toJson());
            } else {
                out.print(RsaReportFormatter.format(result));
            }
            out.flush();
            return EXIT_SUCCESS;
        } catch (RsaPipelineException e) {
            logger.error("Simulation failed in {}", e.getOperation(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            logger.error("Simulation failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
