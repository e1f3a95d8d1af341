package com.ospicorp.loadshape.series.service;

import com.ospicorp.loadshape.exception.InvalidTimestampException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the timestamp shapes found in meter and weather feeds into UTC epoch seconds.
 *
 * <p>Accepted inputs are epoch numbers (seconds, or milliseconds when they have more than ten
 * digits), numeric strings, {@code yyyy-MM-dd} and {@code yyyy-MM-dd HH:mm:ss} strings read in
 * the supplied zone, and zone-aware {@link Instant}, {@link ZonedDateTime} and
 * {@link OffsetDateTime} values. Naive {@link LocalDateTime}/{@link LocalDate} values are
 * rejected. Fractional seconds are truncated.
 */
public final class TimestampNormalizer {
  private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

  private static final int MAX_SECOND_DIGITS = 10;
  // 2^63
  private static final double LONG_RANGE_LIMIT = 0x1p63;
  private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d*)?([eE][-+]?\\d+)?");
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter DATE_TIME_OFFSET =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss Z");

  private TimestampNormalizer() {
  }

  public static long normalize(Object input, ZoneId zone) {
    if (input == null) {
      throw new InvalidTimestampException("timestamp must not be null");
    }
    if (input instanceof Instant instant) {
      return instant.getEpochSecond();
    }
    if (input instanceof ZonedDateTime zoned) {
      return zoned.toEpochSecond();
    }
    if (input instanceof OffsetDateTime offset) {
      return offset.toEpochSecond();
    }
    if (input instanceof LocalDateTime || input instanceof LocalDate) {
      throw new InvalidTimestampException("timestamps must not be naive: " + input);
    }
    if (input instanceof Number number) {
      return fromEpochNumber(number);
    }
    if (input instanceof CharSequence text) {
      return parseText(text.toString().trim(), zone);
    }
    throw new InvalidTimestampException(
        "Unsupported timestamp type " + input.getClass().getName() + ": " + input);
  }

  public static ZonedDateTime toZonedDateTime(long timestamp, ZoneId zone) {
    return Instant.ofEpochSecond(toEpochSeconds(timestamp)).atZone(zone);
  }

  public static String format(long timestamp, ZoneId zone) {
    return DATE_TIME.format(toZonedDateTime(timestamp, zone));
  }

  public static String formatWithOffset(long timestamp, ZoneId zone) {
    return DATE_TIME_OFFSET.format(toZonedDateTime(timestamp, zone));
  }

  public static int digitCount(long value) {
    return value == Long.MIN_VALUE ? 19 : Long.toString(Math.abs(value)).length();
  }

  public static ZoneId resolveZone(String name) {
    if (name == null || name.isBlank()) {
      log.warn("No timezone supplied; assuming OS default {}", ZoneId.systemDefault());
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(name.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("Unknown timezone: " + name, ex);
    }
  }

  private static long fromEpochNumber(Number number) {
    long whole;
    if (number instanceof Double || number instanceof Float) {
      double value = number.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new InvalidTimestampException("timestamp is not a finite number: " + number);
      }
      if (value >= LONG_RANGE_LIMIT || value < -LONG_RANGE_LIMIT) {
        throw new InvalidTimestampException("timestamp is out of range: " + number);
      }
      whole = (long) value;
    } else if (number instanceof BigDecimal decimal) {
      whole = exactLong(decimal.toBigInteger(), number);
    } else if (number instanceof BigInteger integer) {
      whole = exactLong(integer, number);
    } else {
      whole = number.longValue();
    }
    return toEpochSeconds(whole);
  }

  private static long exactLong(BigInteger value, Number original) {
    try {
      return value.longValueExact();
    } catch (ArithmeticException ex) {
      throw new InvalidTimestampException("timestamp is out of range: " + original, ex);
    }
  }

  private static long toEpochSeconds(long value) {
    return digitCount(value) > MAX_SECOND_DIGITS ? value / 1000 : value;
  }

  private static long parseText(String text, ZoneId zone) {
    if (NUMERIC.matcher(text).matches()) {
      return fromEpochNumber(new BigDecimal(text));
    }
    Objects.requireNonNull(zone, "zone is required to read local date strings");
    try {
      LocalDateTime local = text.indexOf(':') >= 0
          ? LocalDateTime.parse(text, DATE_TIME)
          : LocalDate.parse(text, DATE).atStartOfDay();
      // repeated fall-back hour resolves to the standard offset
      return ZonedDateTime.of(local, zone).withLaterOffsetAtOverlap().toEpochSecond();
    } catch (DateTimeParseException ex) {
      throw new InvalidTimestampException("Unrecognized timestamp: '" + text
          + "'. Expected epoch seconds/milliseconds, yyyy-MM-dd or yyyy-MM-dd HH:mm:ss", ex);
    }
  }
}
