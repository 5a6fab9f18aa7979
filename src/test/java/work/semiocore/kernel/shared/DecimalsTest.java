package work.semiocore.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class DecimalsTest {
    @Test
    void roundsAwayBinaryNoise() {
        assertEquals(0.3, Decimals.round10(0.1 + 0.2));
        assertEquals(0.6666666667, Decimals.round10(2.0 / 3.0));
        assertEquals(1.0e-12, Decimals.round(1.0e-12, 12));
    }

    @Test
    void normalizesNegativeZero() {
        double rounded = Decimals.round10(-1.0e-12);
        assertEquals(0, Double.compare(0.0, rounded));
    }

    @Test
    void formatsMinimalPlainDecimals() {
        assertEquals("0.5", Decimals.formatMinimal(0.5));
        assertEquals("1", Decimals.formatMinimal(1.0));
        assertEquals("-0.25", Decimals.formatMinimal(-0.25));
        assertEquals("100", Decimals.formatMinimal(100.0));
        assertEquals("0.0000001", Decimals.formatMinimal(1.0e-7));
        assertEquals("0", Decimals.formatMinimal(-0.0));
    }

    @Test
    void formatsShortestDigitsRegardlessOfJdk() {
        assertEquals("100000000000000000000000", Decimals.formatMinimal(1.0E23));
        assertEquals("282879384806159000", Decimals.formatMinimal(2.82879384806159E17));
        assertEquals("0.3", Decimals.formatMinimal(0.3));
    }
}
