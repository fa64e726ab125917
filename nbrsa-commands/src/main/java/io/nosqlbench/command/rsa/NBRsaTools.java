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

package io.nosqlbench.command.rsa;

import io.nosqlbench.command.rsa.subcommands.CMD_rsa_models;
import io.nosqlbench.command.rsa.subcommands.CMD_rsa_simulate;
import picocli.CommandLine;

/// Entry point for the RSA simulation tools.
@CommandLine.Command(name = "nbrsa",
    header = "Simulate clustered response data and compare representational geometry models",
    description = """
        Generates synthetic multivariate responses with known category clustering,
        decodes the categories, and regresses the observed dissimilarity structure
        onto model RDMs.
        """,
    mixinStandardHelpOptions = true,
    exitCodeList = {"0: success", "2: error"},
    subcommands = {CMD_rsa_simulate.class, CMD_rsa_models.class, CommandLine.HelpCommand.class})
public class NBRsaTools {

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new NBRsaTools())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
