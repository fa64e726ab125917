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

package io.nosqlbench.rsa.dataset;

/// Named feature counts for generated datasets, from a two-voxel toy up to a ROI-sized
/// feature space.
public enum DatasetSize {
    TINY(2),
    SMALL(4),
    NORMAL(6),
    BIG(40),
    HUGE(200);

    private final int featureCount;

    DatasetSize(int featureCount) {
        this.featureCount = featureCount;
    }

    public int getFeatureCount() {
        return featureCount;
    }
}
