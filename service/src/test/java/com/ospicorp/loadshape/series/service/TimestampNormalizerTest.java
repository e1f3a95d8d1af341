package com.ospicorp.loadshape.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.loadshape.exception.InvalidTimestampException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class TimestampNormalizerTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
  private static final long OCT_12_2013 = 1381561200L;

  @Test
  void readsLocalDateTimeStringInZone() {
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize("2013-10-12 00:00:00", LA));
  }

  @Test
  void readsBareDateAsLocalMidnight() {
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize("2013-10-12", LA));
  }

  @Test
  void epochSecondsPassThrough() {
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize(OCT_12_2013, LA));
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize((int) OCT_12_2013, LA));
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize("1381561200", LA));
  }

  @Test
  void millisecondsAreScaledDown() {
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize(1381561200000L, LA));
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize("1381561200123", LA));
  }

  @Test
  void fractionalSecondsAreTruncated() {
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize(1381561200.9d, LA));
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize("1381561200.75", LA));
  }

  @Test
  void zoneAwareValuesIgnoreSuppliedZone() {
    ZonedDateTime zoned = ZonedDateTime.of(2013, 10, 12, 0, 0, 0, 0, LA);
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize(zoned, ZoneOffset.UTC));
    assertEquals(OCT_12_2013,
        TimestampNormalizer.normalize(zoned.toOffsetDateTime(), ZoneOffset.UTC));
    assertEquals(OCT_12_2013,
        TimestampNormalizer.normalize(Instant.ofEpochSecond(OCT_12_2013), ZoneOffset.UTC));
  }

  @Test
  void repeatedFallBackHourUsesStandardTime() {
    // 01:30 PST, the second pass through 01:30 on 2013-11-03
    assertEquals(1383471000L, TimestampNormalizer.normalize("2013-11-03 01:30:00", LA));
    assertEquals(1383462000L, TimestampNormalizer.normalize("2013-11-03 00:00:00", LA));
  }

  @Test
  void outOfRangeNumbersAreRejected() {
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize("1e30", LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(1e30d, LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(new BigInteger("100000000000000000000"), LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(new BigDecimal("-1e25"), LA));
  }

  @Test
  void normalizingTwiceIsStable() {
    long once = TimestampNormalizer.normalize("2013-10-12 00:00:00", LA);
    assertEquals(once, TimestampNormalizer.normalize(once, LA));
  }

  @Test
  void naiveTemporalsAreRejected() {
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(LocalDateTime.of(2013, 10, 12, 0, 0), LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(LocalDate.of(2013, 10, 12), LA));
  }

  @Test
  void malformedInputsAreRejected() {
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize("12/10/2013", LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize("2013-02-30 00:00:00", LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(null, LA));
    assertThrows(InvalidTimestampException.class,
        () -> TimestampNormalizer.normalize(new Object(), LA));
  }

  @Test
  void formatsInZone() {
    assertEquals("2013-10-12 00:00:00", TimestampNormalizer.format(OCT_12_2013, LA));
    assertEquals("2013-10-12 00:00:00 -0700",
        TimestampNormalizer.formatWithOffset(OCT_12_2013, LA));
  }

  @Test
  void offsetStringRoundTripsThroughOffsetDateTime() {
    OffsetDateTime parsed = OffsetDateTime.of(2013, 10, 12, 0, 0, 0, 0, ZoneOffset.ofHours(-7));
    assertEquals(OCT_12_2013, TimestampNormalizer.normalize(parsed, ZoneOffset.UTC));
  }

  @Test
  void resolveZoneRejectsUnknownIds() {
    assertEquals(LA, TimestampNormalizer.resolveZone("America/Los_Angeles"));
    assertEquals(ZoneId.systemDefault(), TimestampNormalizer.resolveZone(null));
    assertThrows(IllegalArgumentException.class,
        () -> TimestampNormalizer.resolveZone("Mars/Olympus_Mons"));
  }
}
