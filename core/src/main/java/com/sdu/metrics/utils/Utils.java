package com.sdu.metrics.utils;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.util.Strings;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hanhan.zhang
 * */
public class Utils {

    private static final Pattern TIME_PATTERN = Pattern.compile("(-?[0-9]+)([a-z]+)?");
    private static final Pattern BYTE_PATTERN = Pattern.compile("([0-9]+)([a-z]+)?");

    private static final ImmutableMap<String, TimeUnit> timeSuffixes = ImmutableMap.<String, TimeUnit> builder()
                                                                                    .put("us", TimeUnit.MICROSECONDS)
                                                                                    .put("ms", TimeUnit.MILLISECONDS)
                                                                                    .put("s", TimeUnit.SECONDS)
                                                                                    .put("m", TimeUnit.MINUTES)
                                                                                    .put("min", TimeUnit.MINUTES)
                                                                                    .put("h", TimeUnit.HOURS)
                                                                                    .put("d", TimeUnit.DAYS)
                                                                                    .build();

    // 单位: 字节数
    private static final ImmutableMap<String, Long> byteSuffixes = ImmutableMap.<String, Long> builder()
                                                                                .put("b", 1L)
                                                                                .put("k", 1L << 10)
                                                                                .put("kb", 1L << 10)
                                                                                .put("m", 1L << 20)
                                                                                .put("mb", 1L << 20)
                                                                                .put("g", 1L << 30)
                                                                                .put("gb", 1L << 30)
                                                                                .put("t", 1L << 40)
                                                                                .put("tb", 1L << 40)
                                                                                .build();

    private Utils() {}

    /**
     * Convert a passed time string (e.g. 50s, 100ms, or 250us) to a time count in the given unit.
     * The unit is also considered the default if the given string does not specify a unit.
     * */
    public static long timeStringAs(String str, TimeUnit unit) {
        if (Strings.isBlank(str)) {
            throw new NumberFormatException("Time string must not be blank");
        }
        String lower = str.toLowerCase(Locale.ROOT).trim();

        try {
            Matcher m = TIME_PATTERN.matcher(lower);
            if (!m.matches()) {
                throw new NumberFormatException("Failed to parse time string: " + str);
            }

            long val = Long.parseLong(m.group(1));
            String suffix = m.group(2);

            // Check for invalid suffixes
            if (suffix != null && !timeSuffixes.containsKey(suffix)) {
                throw new NumberFormatException("Invalid suffix: \"" + suffix + "\"");
            }

            // If suffix is valid use that, otherwise none was provided and use the default passed
            return unit.convert(val, suffix != null ? timeSuffixes.get(suffix) : unit);
        } catch (NumberFormatException e) {
            String timeError = "Time must be specified as seconds (s), " +
                    "milliseconds (ms), microseconds (us), minutes (m or min), hour (h), or day (d). " +
                    "E.g. 50s, 100ms, or 250us.";

            throw new NumberFormatException(timeError + "\n" + e.getMessage());
        }
    }

    /**
     * Convert a passed byte string (e.g. 50b, 100k, or 250m) to bytes. A string without suffix is
     * taken as bytes.
     * */
    public static long byteStringAsBytes(String str) {
        if (Strings.isBlank(str)) {
            throw new NumberFormatException("Size string must not be blank");
        }
        String lower = str.toLowerCase(Locale.ROOT).trim();

        try {
            Matcher m = BYTE_PATTERN.matcher(lower);
            if (!m.matches()) {
                throw new NumberFormatException("Failed to parse byte string: " + str);
            }

            long val = Long.parseLong(m.group(1));
            String suffix = m.group(2);
            if (suffix == null) {
                return val;
            }
            Long multiplier = byteSuffixes.get(suffix);
            if (multiplier == null) {
                throw new NumberFormatException("Invalid suffix: \"" + suffix + "\"");
            }
            return Math.multiplyExact(val, multiplier);
        } catch (NumberFormatException | ArithmeticException e) {
            String byteError = "Size must be specified as bytes (b), " +
                    "kibibytes (k), mebibytes (m), gibibytes (g) or tebibytes (t). " +
                    "E.g. 50b, 100k, or 250m.";

            throw new NumberFormatException(byteError + "\n" + e.getMessage());
        }
    }
}
