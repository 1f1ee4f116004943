package io.tabfields.codec;

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

import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("DiscreteField")
class DiscreteFieldTest {

    private final DiscreteField<String> abc = new DiscreteField<>("letter", List.of("a", "b", "c"));

    @Test
    @DisplayName("should one-hot encode in vocabulary order")
    void shouldEncodeOneHot() {
        assertThat(abc.normalize("b")).containsExactly(0.0, 1.0, 0.0);
        assertThat(abc.normalizeAll(List.of("a", "c")))
            .isDeepEqualTo(new double[][]{{1, 0, 0}, {0, 0, 1}});
        assertThat(abc.width()).isEqualTo(3);
    }

    @Test
    @DisplayName("should encode unknown categories as all-zero rows")
    void shouldEncodeUnknownAsZeros() {
        assertThat(abc.normalize("z")).containsExactly(0.0, 0.0, 0.0);
        assertThat(abc.normalize(null)).containsExactly(0.0, 0.0, 0.0);
        assertThat(abc.indexOf("z")).isEqualTo(-1);
    }

    @Test
    @DisplayName("should decode the arg-max column")
    void shouldDecodeArgMax() {
        assertThat(abc.denormalize(new double[]{0, 1, 0})).isEqualTo("b");
        assertThat(abc.denormalize(new double[]{0.2, 0.3, 0.5})).isEqualTo("c");
        assertThat(abc.denormalizeAll(new double[][]{{1, 0, 0}, {0, 0, 1}})).containsExactly("a", "c");
    }

    @Test
    @DisplayName("should break ties toward the lowest index")
    void shouldBreakTiesLow() {
        assertThat(abc.denormalize(new double[]{0.1, 0.45, 0.45})).isEqualTo("b");
        assertThat(abc.denormalize(new double[]{0, 0, 0})).isEqualTo("a");
    }

    @Test
    @DisplayName("should ignore NaN scores wherever they appear")
    void shouldIgnoreNaN() {
        assertThat(abc.denormalize(new double[]{Double.NaN, 0.9, 0.1})).isEqualTo("b");
        assertThat(abc.denormalize(new double[]{0.1, Double.NaN, 0.9})).isEqualTo("c");
        assertThat(abc.denormalize(new double[]{0.1, 0.9, Double.NaN})).isEqualTo("b");
        assertThat(abc.denormalize(new double[]{Double.NaN, Double.NaN, Double.NaN})).isEqualTo("a");
    }

    @Test
    @DisplayName("should always decode to a vocabulary entry")
    void shouldAlwaysDecodeToVocabulary() {
        assertThat(abc.denormalize(abc.normalize("z"))).isIn(abc.getVocabulary());
    }

    @Test
    @DisplayName("should reject rows of the wrong width")
    void shouldRejectWrongWidth() {
        assertThatThrownBy(() -> abc.denormalize(new double[]{0, 1}))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("should reject malformed vocabularies")
    void shouldRejectMalformedVocabulary() {
        assertThatThrownBy(() -> new DiscreteField<String>("v", null))
            .isInstanceOf(InvalidFieldConfigException.class)
            .hasMessageContaining("should be a list");
        assertThatThrownBy(() -> new DiscreteField<String>("v", List.of()))
            .isInstanceOf(InvalidFieldConfigException.class);
        assertThatThrownBy(() -> new DiscreteField<>("v", List.of("a", "b", "a")))
            .isInstanceOf(InvalidFieldConfigException.class)
            .hasMessageContaining("repeats");
        assertThatThrownBy(() -> new DiscreteField<>("v", Arrays.asList("a", null)))
            .isInstanceOf(InvalidFieldConfigException.class);
    }

    @Test
    @DisplayName("should not be affected by later changes to the source list")
    void shouldCopyVocabulary() {
        List<String> labels = new ArrayList<>(List.of("x", "y"));
        DiscreteField<String> field = new DiscreteField<>("v", labels);

        labels.add("z");

        assertThat(field.width()).isEqualTo(2);
        assertThat(field.getVocabulary()).containsExactly("x", "y");
    }

    @Test
    @DisplayName("should support non-string labels")
    void shouldSupportIntegerLabels() {
        DiscreteField<Integer> codes = new DiscreteField<>("code", List.of(200, 404, 500));

        assertThat(codes.normalize(404)).containsExactly(0.0, 1.0, 0.0);
        assertThat(codes.denormalize(new double[]{0, 0, 1})).isEqualTo(500);
    }

    @Test
    @DisplayName("should describe one discrete output as wide as the vocabulary")
    void shouldDescribe() {
        assertThat(abc.describe()).containsExactly(OutputDescriptor.discrete(3));
        assertThat(abc.descriptor().normalizationMode()).isEmpty();
    }
}
