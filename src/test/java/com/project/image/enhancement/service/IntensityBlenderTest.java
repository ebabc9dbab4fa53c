package com.project.image.enhancement.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntensityBlenderTest {
    private final int[] original = {0, 10, 100, 200, 255};
    private final int[] equalized = {0, 60, 180, 255, 255};

    @Test
    void zeroIntensity_keepsOriginal() {
        assertThat(IntensityBlender.blend(original, equalized, 0.0)).isEqualTo(original);
    }

    @Test
    void fullIntensity_takesEqualized() {
        assertThat(IntensityBlender.blend(original, equalized, 1.0)).isEqualTo(equalized);
    }

    @Test
    void halfIntensity_roundsTheMidpoint() {
        int[] out = IntensityBlender.blend(new int[]{0, 10}, new int[]{255, 13}, 0.5);
        assertThat(out).containsExactly(128, 12);
    }

    @Test
    void blend_neverLeavesByteRange() {
        Random rnd = new Random(7);
        int[] a = new int[1000], b = new int[1000];
        for (int i = 0; i < a.length; i++) {
            a[i] = rnd.nextInt(256);
            b[i] = rnd.nextInt(256);
        }
        for (double t = 0.0; t <= 1.0; t += 0.05) {
            int[] out = IntensityBlender.blend(a, b, Math.min(t, 1.0));
            assertThat(Arrays.stream(out).boxed().toList()).allSatisfy(v -> assertThat(v).isBetween(0, 255));
        }
    }

    @Test
    void rejectsIntensityOutsideUnitRange() {
        assertThatThrownBy(() -> IntensityBlender.blend(original, equalized, -0.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntensityBlender.blend(original, equalized, 1.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntensityBlender.blend(original, equalized, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsPlanesOfDifferentSize() {
        assertThatThrownBy(() -> IntensityBlender.blend(new int[3], new int[4], 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
