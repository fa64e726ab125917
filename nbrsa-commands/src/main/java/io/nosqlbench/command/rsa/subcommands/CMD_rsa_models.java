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

import io.nosqlbench.rsa.cluster.ClusterSpec;
import io.nosqlbench.rsa.exceptions.RsaPipelineException;
import io.nosqlbench.rsa.rdm.ModelRdm;
import io.nosqlbench.rsa.rdm.ModelRdmGenerator;
import io.nosqlbench.rsa.rdm.ModelSchemes;
import io.nosqlbench.rsa.report.RsaReportFormatter;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Prints the hypothesis model RDMs without generating any data.
@CommandLine.Command(name = "models",
    description = "Print the model RDMs used as regressors")
public class CMD_rsa_models implements Callable<Integer> {

    @CommandLine.Option(names = {"-c", "--categories"}, description = "Number of categories", defaultValue = "8")
    private int categories = 8;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<ModelRdm> models;
        try {
            models = new ModelRdmGenerator().generate(categories, ModelSchemes.defaults());
        } catch (RsaPipelineException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 2;
        }
        List<String> axis = new ArrayList<>(categories);
        for (int i = 1; i <= categories; i++) {
            axis.add(String.valueOf(i));
        }
        for (ModelRdm model : models) {
            out.println("Model RDM: " + model.getDescription());
            for (ClusterSpec cluster : model.getClusters()) {
                out.println("  " + cluster.description() + " " + cluster.targets());
            }
            out.println(RsaReportFormatter.formatMatrix(model.getMatrix(), axis));
        }
        out.flush();
        return 0;
    }
}
