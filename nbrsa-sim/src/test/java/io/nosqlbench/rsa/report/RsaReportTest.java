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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.rsa.pipeline.RsaAnalysisResult;
import io.nosqlbench.rsa.pipeline.RsaPipeline;
import io.nosqlbench.rsa.pipeline.SimulationConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class RsaReportTest {

    private static RsaAnalysisResult result;

    @BeforeAll
    public static void runPipeline() {
        result = new RsaPipeline().run(SimulationConfig.defaults());
    }

    @Test
    public void testJsonCarriesModelsAndRdm() {
        String json = RsaReport.from(result).toJson();
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertEquals("IT", root.get("roi").getAsString());
        assertEquals(42L, root.get("seed").getAsLong());
        JsonArray models = root.getAsJsonArray("models");
        assertEquals(3, models.size());
        assertEquals("Animate vs. Inanimate", models.get(0).getAsJsonObject().get("description").getAsString());
        assertEquals(8, root.getAsJsonArray("observed_rdm").size());
        assertEquals(5, root.getAsJsonArray("clusters").size());
        assertTrue(root.has("accuracy"));
    }

    @Test
    public void testTextReportSections() {
        String text = RsaReportFormatter.format(result);
        assertThat(text)
            .contains("Cluster 1: Animate")
            .contains("Sigma Level: 0.70")
            .contains("Target to Label Mapping:")
            .contains("Classification accuracy:")
            .contains("Observed RDM")
            .contains("Model RDM: Grouped Pairs")
            .contains("Regression coefficients (OLS");
    }

    @Test
    public void testMatrixRowsAreLabelled() {
        String matrix = RsaReportFormatter.formatMatrix(new double[][]{{0, 2}, {2, 0}}, List.of("a", "b"));
        String[] lines = matrix.split("\n");
        assertThat(lines[lines.length - 2]).startsWith("a");
        assertThat(lines[lines.length - 1]).startsWith("b").contains("2.000");
    }
}
