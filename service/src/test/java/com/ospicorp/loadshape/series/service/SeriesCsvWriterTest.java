package com.ospicorp.loadshape.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.loadshape.series.model.RawReading;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesCsvWriterTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");

  @Test
  void writesLocalTimestampsWithoutHeader() {
    StringWriter out = new StringWriter();
    SeriesCsvWriter.write(List.of(new SeriesPoint(1381561200L, 12.5)), LA, out);

    String[] lines = out.toString().strip().split("\\R");
    assertEquals(1, lines.length);
    assertTrue(lines[0].contains("2013-10-12 00:00:00"));
    assertTrue(lines[0].endsWith(",12.5"));
  }

  @Test
  void writtenFileReadsBackToTheSamePoints() {
    Series original = Series.builder()
        .readings(List.of(
            new RawReading(1381561200L, 1.25),
            new RawReading(1381562100L, 2.5),
            new RawReading(1381563000L, 3.75)))
        .zone(LA)
        .build();
    StringWriter out = new StringWriter();
    SeriesCsvWriter.write(original, out);

    Series copy = Series.builder().csv(new StringReader(out.toString())).zone(LA).build();

    assertEquals(original.points(), copy.points());
  }

  @Test
  void honoursExclusionsAndBounds() {
    Series series = Series.builder()
        .readings(List.of(
            new RawReading(100L, 1.0),
            new RawReading(200L, 2.0),
            new RawReading(300L, 3.0)))
        .zone(ZoneId.of("UTC"))
        .build();
    series.addExclusion(200L, 200L);

    StringWriter excluded = new StringWriter();
    SeriesCsvWriter.write(series, excluded);
    StringWriter bounded = new StringWriter();
    SeriesCsvWriter.write(series, bounded, 200L, 300L, false);

    assertEquals(2, excluded.toString().strip().split("\\R").length);
    assertEquals(2, bounded.toString().strip().split("\\R").length);
  }
}
