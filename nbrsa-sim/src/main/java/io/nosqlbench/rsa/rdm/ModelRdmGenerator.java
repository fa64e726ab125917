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

import io.nosqlbench.rsa.cluster.ClusterSpec;
import io.nosqlbench.rsa.cluster.ClusteringScheme;
import io.nosqlbench.rsa.exceptions.InvalidClusterSpecException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Builds one [ModelRdm] per clustering scheme from category groupings alone. Cluster
/// strengths are ignored and no sampled data is involved.
///
/// Every cell starts at 2. Each cluster sets the cells between all pairs of its members to
/// 0, which covers the diagonal entries of the members as well. Overlapping clusters are
/// idempotent. Pairs never grouped by any cluster stay at 2. The diagonal is always 0, also
/// for a category no cluster mentions.
public class ModelRdmGenerator {

    public static final double SAME_CLUSTER = 0.0;
    public static final double DIFFERENT_CLUSTER = 2.0;

    /// @param nCategories matrix size `C`
    /// @param schemes hypothesis schemes
    /// @return one model per scheme, in input order
    public List<ModelRdm> generate(int nCategories, List<ClusteringScheme> schemes) {
        List<ModelRdm> models = new ArrayList<>(schemes.size());
        for (ClusteringScheme scheme : schemes) {
            models.add(generate(nCategories, scheme));
        }
        return models;
    }

    /// @param nCategories matrix size `C`
    /// @param scheme the scheme whose groupings define the model
    /// @return the model RDM
    /// @throws InvalidClusterSpecException if a cluster references an id beyond `C`
    public ModelRdm generate(int nCategories, ClusteringScheme scheme) {
        if (nCategories < 2) {
            throw new IllegalArgumentException("At least two categories are required, got " + nCategories);
        }
        double[][] dsm = new double[nCategories][nCategories];
        for (double[] row : dsm) {
            Arrays.fill(row, DIFFERENT_CLUSTER);
        }
        for (ClusterSpec cluster : scheme.clusters()) {
            int[] members = cluster.targetArray();
            for (int id : members) {
                if (id > nCategories) {
                    throw new InvalidClusterSpecException("ModelRdmGenerator", members,
                        "target id " + id + " is outside 1.." + nCategories);
                }
            }
            for (int i : members) {
                for (int j : members) {
                    dsm[i - 1][j - 1] = SAME_CLUSTER;
                }
            }
        }
        for (int i = 0; i < nCategories; i++) {
            dsm[i][i] = SAME_CLUSTER;
        }
        return new ModelRdm(scheme.name(), dsm, scheme.clusters());
    }
}
