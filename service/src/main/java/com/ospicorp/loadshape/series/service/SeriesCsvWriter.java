package com.ospicorp.loadshape.series.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.ZoneId;
import java.util.List;

/**
 * Writes series data as headerless {@code yyyy-MM-dd HH:mm:ss,value} rows with timestamps in the
 * series' own zone. Baseline model scripts read this layout.
 */
public final class SeriesCsvWriter {
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA;

  static {
    MAPPER.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    SCHEMA = MAPPER.schemaFor(ExportRow.class).withoutHeader();
  }

  private SeriesCsvWriter() {
  }

  public static void write(Series series, Writer out) {
    write(series, out, null, null, true);
  }

  public static void write(Series series, Writer out, Object startAt, Object endAt,
      boolean exclude) {
    write(series.data(startAt, endAt, exclude), series.zone(), out);
  }

  public static void write(List<SeriesPoint> points, ZoneId zone, Writer out) {
    try (SequenceWriter rows = MAPPER.writer(SCHEMA).writeValues(out)) {
      for (SeriesPoint p : points) {
        rows.write(new ExportRow(TimestampNormalizer.format(p.timestamp(), zone),
            p.value()));
      }
      rows.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to write series CSV", ex);
    }
  }

  @JsonPropertyOrder({"timestamp", "value"})
  public record ExportRow(String timestamp, double value) {}
}
