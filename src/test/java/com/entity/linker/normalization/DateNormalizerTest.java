package com.entity.linker.normalization;

import com.entity.linker.core.model.DatePrecision;
import com.entity.linker.core.model.PartialDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateNormalizer Tests")
class DateNormalizerTest {

    private final DateNormalizer normalizer = new DateNormalizer();

    @Test
    @DisplayName("Should parse year, month and day precision")
    void parsesPrecisions() {
        assertEquals(Optional.of(PartialDate.ofYear(1897)), normalizer.parse("1897"));
        assertEquals(Optional.of(PartialDate.ofMonth(1897, 6)), normalizer.parse("1897-06"));
        assertEquals(Optional.of(PartialDate.of(1897, 6, 5)), normalizer.parse("1897-06-05"));
    }

    @Test
    @DisplayName("Should parse ISO timestamps")
    void parsesTimestamps() {
        assertEquals(Optional.of(PartialDate.of(1897, 6, 5)), normalizer.parse("+1897-06-05T00:00:00Z"));
        assertEquals(Optional.of(PartialDate.of(2000, 1, 31)), normalizer.parse("2000-01-31T12:30:00+02:00"));
    }

    @Test
    @DisplayName("Zero month or day should mean unknown")
    void zeroComponentsAreUnknown() {
        assertEquals(Optional.of(PartialDate.ofYear(1743)), normalizer.parse("1743-00-00T00:00:00Z"));
        assertEquals(Optional.of(PartialDate.ofMonth(1743, 4)), normalizer.parse("1743-04-00"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a date", "1897-13-01", "1897-02-30", "05/06/1897"})
    @DisplayName("Should return empty for unusable input")
    void unusableInput(String raw) {
        assertTrue(normalizer.parse(raw).isEmpty());
    }

    @Test
    @DisplayName("Should truncate to an explicit precision")
    void truncatesToPrecision() {
        assertEquals(Optional.of(PartialDate.ofYear(1897)),
                normalizer.parse("1897-06-05T00:00:00Z", DatePrecision.YEAR));
    }
}
