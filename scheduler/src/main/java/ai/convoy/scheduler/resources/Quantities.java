package ai.convoy.scheduler.resources;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Kubernetes quantity notation, e.g. {@code "4"}, {@code "500m"}, {@code "1.5Gi"}, {@code "2e3"}.
 * Values are held as milli-units and rounded up, as Kubernetes does for sub-milli precision.
 */
public final class Quantities {
    private static final Pattern QUANTITY = Pattern.compile(
        "^([+-]?[0-9]+(?:\\.[0-9]*)?|[+-]?\\.[0-9]+)(Ki|Mi|Gi|Ti|Pi|Ei|[eE][+-]?[0-9]+|[numkMGTPE])?$");

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int MAX_MILLI_DIGITS = String.valueOf(Long.MAX_VALUE).length();

    private static final Map<String, BigDecimal> SUFFIXES = Map.ofEntries(
        Map.entry("n", new BigDecimal("1e-9")),
        Map.entry("u", new BigDecimal("1e-6")),
        Map.entry("m", new BigDecimal("1e-3")),
        Map.entry("k", new BigDecimal("1e3")),
        Map.entry("M", new BigDecimal("1e6")),
        Map.entry("G", new BigDecimal("1e9")),
        Map.entry("T", new BigDecimal("1e12")),
        Map.entry("P", new BigDecimal("1e15")),
        Map.entry("E", new BigDecimal("1e18")),
        Map.entry("Ki", BigDecimal.valueOf(1L << 10)),
        Map.entry("Mi", BigDecimal.valueOf(1L << 20)),
        Map.entry("Gi", BigDecimal.valueOf(1L << 30)),
        Map.entry("Ti", BigDecimal.valueOf(1L << 40)),
        Map.entry("Pi", BigDecimal.valueOf(1L << 50)),
        Map.entry("Ei", BigDecimal.valueOf(1L << 60)));

    private Quantities() {
    }

    /**
     * @throws IllegalArgumentException on malformed, negative or out-of-range quantities
     */
    public static long parseMillis(String quantity) {
        var trimmed = quantity.trim();
        var matcher = QUANTITY.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Cannot parse quantity '" + quantity + "'");
        }

        try {
            return toMillis(matcher.group(1), matcher.group(2), quantity);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Quantity '" + quantity + "' is out of range", e);
        }
    }

    private static long toMillis(String number, String suffix, String quantity) {
        var value = new BigDecimal(number);
        if (suffix != null) {
            if (suffix.charAt(0) == 'e' || suffix.charAt(0) == 'E') {
                value = value.scaleByPowerOfTen(Integer.parseInt(suffix.substring(1)));
            } else {
                value = value.multiply(SUFFIXES.get(suffix));
            }
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative quantity '" + quantity + "'");
        }
        if (value.signum() == 0) {
            return 0;
        }

        var millis = value.multiply(THOUSAND);
        // digits left of the decimal point
        long integerDigits = (long) millis.precision() - millis.scale();
        if (integerDigits > MAX_MILLI_DIGITS) {
            throw new IllegalArgumentException("Quantity '" + quantity + "' is out of range");
        }
        if (integerDigits <= 0) {
            return 1;
        }
        return millis.setScale(0, RoundingMode.CEILING).longValueExact();
    }

    public static String format(long millis) {
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return millis + "m";
    }
}
