package work.semiocore.kernel.shared;

import com.fasterxml.jackson.core.io.schubfach.DoubleToDecimal;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding and formatting helpers shared by the engine, scanner and serializers.
 */
public final class Decimals {
    private Decimals() {}

    /**
     * Rounds the exact binary value of {@code value} to {@code digits} decimal places, ties to even.
     */
    public static double round(double value, int digits) {
        if (!Double.isFinite(value)) {
            return value;
        }
        double rounded = new BigDecimal(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
        return rounded == 0.0 ? 0.0 : rounded;
    }

    public static double round10(double value) {
        return round(value, 10);
    }

    /**
     * Shortest round-trip rendering without exponent notation ({@code 0.5}, {@code 1}, {@code -0.25}).
     * Digits come from Schubfach, which is shortest on every JDK; {@code Double.toString} is not
     * before JDK 19.
     */
    public static String formatMinimal(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return new BigDecimal(DoubleToDecimal.toString(value)).stripTrailingZeros().toPlainString();
    }
}
