package com.ospicorp.loadshape.series.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.loadshape.series.model.RawReading;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads headerless delimited rows: column 0 is the timestamp, {@code dataColumn} the value. Rows
 * too short to hold the value column come back with a {@code null} value and are dropped by
 * {@link Series}.
 */
public final class SeriesCsvReader {
  private static final CsvMapper MAPPER = new CsvMapper()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
      .enable(CsvParser.Feature.ALLOW_COMMENTS);

  private SeriesCsvReader() {
  }

  public static List<RawReading> read(Reader reader, int dataColumn) {
    List<RawReading> out = new ArrayList<>();
    try (MappingIterator<String[]> rows = MAPPER.readerFor(String[].class).readValues(reader)) {
      while (rows.hasNext()) {
        String[] row = rows.next();
        if (row.length == 0 || (row.length == 1 && row[0].isBlank())) {
          continue;
        }
        String value = row.length > dataColumn ? row[dataColumn] : null;
        out.add(new RawReading(row[0].trim(), value));
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read series CSV", ex);
    }
    return out;
  }
}
