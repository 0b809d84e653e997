package com.compid.core.version;

import com.compid.core.model.CompilerRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VersionRangeAlgebra}.
 */
class VersionRangeAlgebraTest {

    private final VersionRangeAlgebra algebra = new VersionRangeAlgebra();
    private final VersionRangeAlgebra legacy =
        new VersionRangeAlgebra(DottedVersionComparator.INSTANCE, IntersectionMode.LEGACY);

    private static final List<String> SPECIFIERS = List.of(
        "", "GCC", "AC6", "GCC@6.0.0", "GCC@10.2.0", "GCC@>=10.2.0", "GCC@>=6.0.0",
        "GCC@>=12.0.0", "AC6@6.18.0", "AC6@>=6.16.0", "GCC@8.0.0..11.0.0", "GCC@10.2",
        "GCC@11.0.0..8.0.0"
    );

    // ========== expand Tests ==========

    @Test
    void expand_minimumVersion_returnsOpenRange() {
        CompilerRange range = algebra.expand("GCC@>=10.2.0");

        assertThat(range.name()).isEqualTo("GCC");
        assertThat(range.minVersion()).isEqualTo("10.2.0");
        assertThat(range.maxVersion()).isNull();
        assertThat(range.max()).isEmpty();
    }

    @Test
    void expand_exactVersion_setsBothBounds() {
        CompilerRange range = algebra.expand("AC6@6.18.0");

        assertThat(range.name()).isEqualTo("AC6");
        assertThat(range.minVersion()).isEqualTo("6.18.0");
        assertThat(range.maxVersion()).isEqualTo("6.18.0");
        assertThat(range.isExact()).isTrue();
    }

    @Test
    void expand_noVersion_returnsAnyVersion() {
        CompilerRange range = algebra.expand("IAR");

        assertThat(range.name()).isEqualTo("IAR");
        assertThat(range.minVersion()).isEqualTo(CompilerRange.LOWEST_VERSION);
        assertThat(range.maxVersion()).isNull();
    }

    @Test
    void expand_trailingAtSign_returnsAnyVersion() {
        CompilerRange range = algebra.expand("GCC@");

        assertThat(range.name()).isEqualTo("GCC");
        assertThat(range.minVersion()).isEqualTo(CompilerRange.LOWEST_VERSION);
    }

    @Test
    void expand_closedRange_setsBothBounds() {
        CompilerRange range = algebra.expand("GCC@8.0.0..11.0.0");

        assertThat(range.minVersion()).isEqualTo("8.0.0");
        assertThat(range.maxVersion()).isEqualTo("11.0.0");
        assertThat(range.isExact()).isFalse();
    }

    @Test
    void expand_null_returnsUnnamedAnyVersion() {
        CompilerRange range = algebra.expand(null);

        assertThat(range.name()).isEmpty();
        assertThat(range.minVersion()).isEqualTo(CompilerRange.LOWEST_VERSION);
    }

    // ========== compatible Tests ==========

    @Test
    void compatible_exactBelowMinimum_returnsFalse() {
        assertThat(algebra.compatible("GCC@6.0.0", "GCC@>=10.2.0")).isFalse();
    }

    @Test
    void compatible_emptySide_returnsTrue() {
        assertThat(algebra.compatible("gcc", "")).isTrue();
        assertThat(algebra.compatible("", "GCC@1.0.0")).isTrue();
        assertThat(algebra.compatible(null, null)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "GCC, GCC@>=10.2.0, true",
        "GCC@10.2.0, GCC@>=10.2.0, true",
        "GCC@10.3.1, GCC@>=10.2.0, true",
        "GCC@>=6.0.0, GCC@>=10.2.0, true",
        "GCC@10.2.0, GCC@10.2.0, true",
        "GCC@10.2.0, GCC@10.3.0, false",
        "GCC, AC6, false",
        "GCC@>=6.0.0, AC6@>=6.0.0, false",
        "GCC@8.0.0..11.0.0, GCC@>=12.0.0, false",
        "GCC@8.0.0..11.0.0, GCC@10.2.0, true"
    })
    void compatible_pairs(String first, String second, boolean expected) {
        assertThat(algebra.compatible(first, second)).isEqualTo(expected);
    }

    @Test
    void compatible_isSymmetric() {
        for (String first : SPECIFIERS) {
            for (String second : SPECIFIERS) {
                assertThat(algebra.compatible(first, second))
                    .as("%s / %s", first, second)
                    .isEqualTo(algebra.compatible(second, first));
            }
        }
    }

    // ========== intersect Tests ==========

    @Test
    void intersect_anyWithMinimum_returnsMinimum() {
        assertThat(algebra.intersect("GCC", "GCC@>=10.2.0")).isEqualTo("GCC@>=10.2.0");
    }

    @Test
    void intersect_bothEmpty_returnsEmpty() {
        assertThat(algebra.intersect("", "")).isEmpty();
    }

    @Test
    void intersect_oneEmpty_returnsOther() {
        assertThat(algebra.intersect("", "GCC@>=10.2.0")).isEqualTo("GCC@>=10.2.0");
        assertThat(algebra.intersect("AC6@6.18.0", "")).isEqualTo("AC6@6.18.0");
        assertThat(algebra.intersect("IAR", "")).isEqualTo("IAR");
    }

    @Test
    void intersect_incompatible_returnsEmpty() {
        assertThat(algebra.intersect("GCC@6.0.0", "GCC@>=10.2.0")).isEmpty();
        assertThat(algebra.intersect("GCC", "AC6")).isEmpty();
    }

    @Test
    void intersect_twoMinimums_returnsGreaterMinimum() {
        assertThat(algebra.intersect("GCC@>=6.0.0", "GCC@>=10.2.0")).isEqualTo("GCC@>=10.2.0");
    }

    @Test
    void intersect_exactWithMinimum_returnsExact() {
        assertThat(algebra.intersect("GCC@10.3.1", "GCC@>=10.2.0")).isEqualTo("GCC@10.3.1");
        assertThat(algebra.intersect("GCC@>=10.2.0", "GCC@10.3.1")).isEqualTo("GCC@10.3.1");
    }

    @Test
    void intersect_anyWithAny_returnsName() {
        assertThat(algebra.intersect("GCC", "GCC")).isEqualTo("GCC");
    }

    @Test
    void intersect_isCommutativeWhereDefined() {
        for (String first : SPECIFIERS) {
            for (String second : SPECIFIERS) {
                String forward = algebra.intersect(first, second);
                String backward = algebra.intersect(second, first);
                if (forward.isEmpty() || backward.isEmpty()) {
                    continue;
                }
                CompilerRange a = algebra.expand(forward);
                CompilerRange b = algebra.expand(backward);
                assertThat(a.name()).as("%s / %s", first, second).isEqualTo(b.name());
                assertThat(DottedVersionComparator.INSTANCE.compare(a.minVersion(), b.minVersion())).isZero();
                assertThat(a.maxVersion() == null).as("%s / %s", first, second).isEqualTo(b.maxVersion() == null);
                if (a.maxVersion() != null) {
                    assertThat(DottedVersionComparator.INSTANCE.compare(a.maxVersion(), b.maxVersion()))
                        .as("%s / %s", first, second)
                        .isZero();
                }
            }
        }
    }

    @Test
    void intersect_chainedMerges_narrowToCommonRange() {
        String merged = "";
        for (String constraint : List.of("GCC", "GCC@>=6.0.0", "", "GCC@>=10.2.0", "GCC@10.3.1")) {
            merged = algebra.intersect(merged.isEmpty() ? constraint : merged, constraint);
        }

        assertThat(merged).isEqualTo("GCC@10.3.1");
    }

    // ========== two-sided range Tests ==========

    @Test
    void intersect_rangeWithMinimum_rangeMode_returnsNarrowedRange() {
        assertThat(algebra.intersect("GCC@8.0.0..11.0.0", "GCC@>=10.2.0")).isEqualTo("GCC@10.2.0..11.0.0");
    }

    @Test
    void intersect_rangeWithMinimum_legacyMode_returnsEmpty() {
        assertThat(legacy.intersect("GCC@8.0.0..11.0.0", "GCC@>=10.2.0")).isEmpty();
    }

    @Test
    void intersect_equivalentBoundsSpelledDifferently_rangeMode_returnsExact() {
        assertThat(algebra.intersect("GCC@>=10.2.0", "GCC@10.2")).isEqualTo("GCC@10.2.0");
    }

    @Test
    void intersect_equivalentBoundsSpelledDifferently_legacyMode_returnsEmpty() {
        assertThat(legacy.intersect("GCC@>=10.2.0", "GCC@10.2")).isEmpty();
    }

    @Test
    void intersect_simpleCases_identicalInBothModes() {
        assertThat(legacy.intersect("GCC", "GCC@>=10.2.0")).isEqualTo("GCC@>=10.2.0");
        assertThat(legacy.intersect("GCC@10.3.1", "GCC@>=10.2.0")).isEqualTo("GCC@10.3.1");
        assertThat(legacy.mode()).isEqualTo(IntersectionMode.LEGACY);
        assertThat(algebra.mode()).isEqualTo(IntersectionMode.RANGE);
    }

    @Test
    void compatible_invertedRange_isCompatibleWithNothingButEmpty() {
        assertThat(algebra.compatible("GCC@11.0.0..8.0.0", "GCC@11.0.0..8.0.0")).isFalse();
        assertThat(algebra.compatible("GCC@11.0.0..8.0.0", "GCC")).isFalse();
        assertThat(algebra.compatible("GCC@9.0.0", "GCC@11.0.0..8.0.0")).isFalse();
        assertThat(algebra.compatible("", "GCC@11.0.0..8.0.0")).isTrue();
    }

    @Test
    void intersect_invertedRange_returnsEmpty() {
        assertThat(algebra.intersect("GCC", "GCC@11.0.0..8.0.0")).isEmpty();
        assertThat(algebra.intersect("GCC@11.0.0..8.0.0", "GCC@11.0.0..8.0.0")).isEmpty();
        assertThat(algebra.intersect("", "GCC@11.0.0..8.0.0")).isEmpty();
        assertThat(legacy.intersect("", "GCC@11.0.0..8.0.0")).isEmpty();
    }

    @Test
    void intersect_results_areCompatibleWithThemselves() {
        for (String first : SPECIFIERS) {
            for (String second : SPECIFIERS) {
                String merged = algebra.intersect(first, second);
                if (merged.isEmpty()) {
                    continue;
                }
                assertThat(algebra.compatible(merged, merged)).as("%s / %s", first, second).isTrue();
                assertThat(algebra.intersect(merged, merged)).as("%s / %s", first, second).isEqualTo(merged);
            }
        }
    }

    @Test
    void intersect_usesInjectedComparator() {
        VersionComparator lexical = String::compareTo;
        VersionRangeAlgebra lexicalAlgebra = new VersionRangeAlgebra(lexical, IntersectionMode.RANGE);

        // lexically "9.0.0" > "10.2.0"
        assertThat(lexicalAlgebra.intersect("GCC@>=9.0.0", "GCC@>=10.2.0")).isEqualTo("GCC@>=9.0.0");
        assertThat(algebra.intersect("GCC@>=9.0.0", "GCC@>=10.2.0")).isEqualTo("GCC@>=10.2.0");
    }

    @Test
    void constructor_nullComparator_throwsException() {
        assertThatThrownBy(() -> new VersionRangeAlgebra(null, IntersectionMode.RANGE))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("comparator must not be null");
    }
}
