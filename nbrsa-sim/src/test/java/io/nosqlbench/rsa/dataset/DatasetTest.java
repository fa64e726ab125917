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

import io.nosqlbench.rsa.exceptions.DimensionMismatchException;
import io.nosqlbench.rsa.exceptions.EmptyCategoryException;
import io.nosqlbench.rsa.exceptions.UnknownTargetIdException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

public class DatasetTest {

    /// Two runs of three categories with easily checked values.
    static Dataset smallDataset() {
        double[][] samples = {
            {1, 2}, {3, 4}, {5, 6},
            {3, 4}, {5, 6}, {7, 8}
        };
        return new Dataset(samples, new int[]{1, 2, 3, 1, 2, 3}, new int[]{1, 1, 1, 2, 2, 2}, new int[6]);
    }

    @Test
    public void testMeanByTarget() {
        Dataset means = smallDataset().meanByTarget(3);
        assertEquals(3, means.getObservationCount());
        assertArrayEquals(new double[]{2, 3}, means.getSample(0));
        assertArrayEquals(new double[]{4, 5}, means.getSample(1));
        assertArrayEquals(new double[]{6, 7}, means.getSample(2));
        assertArrayEquals(new int[]{1, 2, 3}, means.getTargets());
    }

    @Test
    public void testMeanByTargetCarriesLabels() {
        Dataset ds = smallDataset();
        ds.attachLabels(TargetLabels.standard());
        Dataset means = ds.meanByTarget(3);
        assertEquals("human face", means.getLabel(0).orElseThrow());
        assertEquals("animal face", means.getLabel(2).orElseThrow());
    }

    @Test
    public void testMeanByTargetMissingCategory() {
        EmptyCategoryException e = assertThrows(EmptyCategoryException.class,
            () -> smallDataset().meanByTarget(4));
        assertEquals(4, e.getTargetId());
        assertThat(e.getMessage()).contains("meanByTarget").contains("4");
    }

    @Test
    public void testAttachLabelsFreezes() {
        Dataset ds = smallDataset();
        ds.attachLabels(TargetLabels.standard());
        assertTrue(ds.isFrozen());
        assertEquals("human body", ds.getLabel(1).orElseThrow());
        assertEquals(6, ds.getLabels().size());
        assertThrows(IllegalStateException.class, () -> ds.replaceSample(0, new double[]{0, 0}));
    }

    @Test
    public void testAttachLabelsUnknownTarget() {
        Dataset ds = smallDataset();
        TargetLabels partial = TargetLabels.of(Map.of(1, "a", 2, "b"));
        assertThatThrownBy(() -> ds.attachLabels(partial))
            .isInstanceOf(UnknownTargetIdException.class)
            .hasMessageContaining("3");
        assertFalse(ds.isFrozen());
    }

    @Test
    public void testConstructorRejectsRaggedRows() {
        double[][] ragged = {{1, 2}, {3}};
        assertThrows(DimensionMismatchException.class,
            () -> new Dataset(ragged, new int[]{1, 2}, new int[]{1, 1}, new int[2]));
    }

    @Test
    public void testCopyIsIndependent() {
        Dataset ds = smallDataset();
        Dataset copy = ds.copy();
        copy.replaceSample(0, new double[]{9, 9});
        assertArrayEquals(new double[]{1, 2}, ds.getSample(0));
        assertArrayEquals(new double[]{9, 9}, copy.getSample(0));
    }

    @Test
    public void testIndicesOf() {
        assertArrayEquals(new int[]{0, 2, 3, 5}, smallDataset().indicesOf(Set.of(1, 3)));
        assertEquals(0, smallDataset().indicesOf(Set.of(7)).length);
    }

    @Test
    public void testMeanByTargetRejectsTargetsBeyondCategoryCount() {
        assertThrows(DimensionMismatchException.class, () -> smallDataset().meanByTarget(2));
    }
}
