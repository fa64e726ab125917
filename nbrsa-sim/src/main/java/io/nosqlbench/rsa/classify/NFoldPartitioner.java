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

package io.nosqlbench.rsa.classify;

import io.nosqlbench.rsa.dataset.Dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Leave-one-chunk-out partitioning: one fold per chunk, testing on that chunk and training
/// on all others.
public final class NFoldPartitioner {

    private NFoldPartitioner() {
    }

    /// @param dataset the dataset to partition
    /// @return folds in ascending chunk order
    public static List<Partition> byChunk(Dataset dataset) {
        int[] chunks = dataset.getChunks();
        int[] distinct = Arrays.stream(chunks).distinct().sorted().toArray();
        if (distinct.length < 2) {
            throw new IllegalArgumentException("At least two chunks are required for n-fold partitioning, got "
                + distinct.length);
        }
        List<Partition> partitions = new ArrayList<>(distinct.length);
        for (int chunk : distinct) {
            int[] test = new int[chunks.length];
            int[] train = new int[chunks.length];
            int nTest = 0;
            int nTrain = 0;
            for (int i = 0; i < chunks.length; i++) {
                if (chunks[i] == chunk) {
                    test[nTest++] = i;
                } else {
                    train[nTrain++] = i;
                }
            }
            partitions.add(new Partition(chunk, Arrays.copyOf(train, nTrain), Arrays.copyOf(test, nTest)));
        }
        return partitions;
    }
}
