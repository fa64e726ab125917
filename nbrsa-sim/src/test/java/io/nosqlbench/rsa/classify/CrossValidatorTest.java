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
import io.nosqlbench.rsa.dataset.DatasetSize;
import io.nosqlbench.rsa.dataset.RandomGenerators;
import io.nosqlbench.rsa.dataset.SyntheticDatasetFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class CrossValidatorTest {

    @Test
    public void testPartitionsHoldOutOneChunkEach() {
        Dataset ds = new SyntheticDatasetFactory().generate(4, 1, 5, 1, 0.5, DatasetSize.SMALL, RandomGenerators.create(1L));
        List<Partition> partitions = NFoldPartitioner.byChunk(ds);

        assertEquals(5, partitions.size());
        for (Partition p : partitions) {
            assertEquals(4, p.testIndices().length);
            assertEquals(16, p.trainIndices().length);
            for (int i : p.testIndices()) {
                assertEquals(p.foldId(), ds.getChunk(i));
            }
            for (int i : p.trainIndices()) {
                assertNotEquals(p.foldId(), ds.getChunk(i));
            }
        }
    }

    @Test
    public void testSingleChunkCannotBePartitioned() {
        Dataset ds = new SyntheticDatasetFactory().generate(4, 1, 1, 2, 0.5, DatasetSize.SMALL, RandomGenerators.create(1L));
        assertThrows(IllegalArgumentException.class, () -> NFoldPartitioner.byChunk(ds));
    }

    @Test
    public void testLowNoiseDecodesWell() {
        Dataset ds = new SyntheticDatasetFactory().generate(8, 1, 10, 1, 0.2, DatasetSize.BIG, RandomGenerators.create(3L));
        CrossValidationResult result = CrossValidator.crossValidate(ds, new LdaClassifier(), NFoldPartitioner.byChunk(ds));

        assertThat(result.accuracy()).isGreaterThan(0.9);
        assertEquals(0.125, result.chanceLevel(), 1e-12);
        assertEquals(80, Arrays.stream(result.confusion()).flatMapToInt(Arrays::stream).sum());
        assertThat(result.predicted()).doesNotContain(0);
    }

    @Test
    public void testPureNoiseDecodesNearChance() {
        Dataset ds = new SyntheticDatasetFactory(0.0).generate(4, 1, 20, 1, 1.0, DatasetSize.SMALL, RandomGenerators.create(8L));
        CrossValidationResult result = CrossValidator.crossValidate(ds, new LdaClassifier(), NFoldPartitioner.byChunk(ds));
        assertThat(result.accuracy()).isLessThan(0.5);
    }

    @Test
    public void testLdaSeparatesObviousClasses() {
        double[][] train = {{0, 0}, {0.1, 0.2}, {5, 5}, {5.2, 4.9}};
        int[] targets = {1, 1, 2, 2};
        double[][] test = {{0.05, 0.1}, {4.8, 5.1}};
        assertArrayEquals(new int[]{1, 2}, new LdaClassifier().classify(train, targets, test));
    }
}
