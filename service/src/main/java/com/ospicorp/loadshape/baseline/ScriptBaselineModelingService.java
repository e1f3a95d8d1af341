package com.ospicorp.loadshape.baseline;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.loadshape.exception.InvalidTimestampException;
import com.ospicorp.loadshape.exception.ModelingServiceException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import com.ospicorp.loadshape.series.model.Validation;
import com.ospicorp.loadshape.series.service.Series;
import com.ospicorp.loadshape.series.service.SeriesCsvWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Runs an external baseline model script. Inputs are handed over as headerless CSV files with
 * local-time timestamps; the script writes the predicted baseline as {@code timestamp,kW} rows
 * and its error statistics as {@code name,value} rows.
 */
@Service
@ConditionalOnProperty(name = "loadshape.baseline.mode", havingValue = "script")
public class ScriptBaselineModelingService implements BaselineModelingService {

  private static final Logger log = LoggerFactory.getLogger(ScriptBaselineModelingService.class);
  private static final CsvMapper CSV = new CsvMapper()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES);

  private final List<String> command;
  private final Duration timeout;

  public ScriptBaselineModelingService(
      @Value("${loadshape.baseline.script.command}") String command,
      @Value("${loadshape.baseline.script.timeout-seconds:300}") long timeoutSeconds) {
    if (command == null || command.isBlank()) {
      throw new IllegalArgumentException("loadshape.baseline.script.command must be set");
    }
    this.command = Arrays.asList(command.trim().split("\\s+"));
    this.timeout = Duration.ofSeconds(timeoutSeconds);
  }

  @Override
  public BaselineResponse predict(BaselineRequest request) {
    Path workDir = null;
    try {
      workDir = Files.createTempDirectory("loadshape-baseline-");
      List<String> cmd = buildCommand(request, workDir);
      String diagnostics = run(cmd, workDir);
      return readResults(workDir, request.zone(), diagnostics);
    } catch (IOException ex) {
      throw new ModelingServiceException("Baseline script I/O failed: " + ex.getMessage(), "",
          ex);
    } finally {
      deleteQuietly(workDir);
    }
  }

  private List<String> buildCommand(BaselineRequest request, Path workDir) throws IOException {
    ZoneId zone = request.zone();
    List<String> cmd = new ArrayList<>(command);
    cmd.add("--loadFile=" + writeCsv(workDir.resolve("load.csv"), request.trainingLoad(), zone));

    List<SeriesPoint> times = new ArrayList<>(request.predictionTimestamps().size());
    for (long t : request.predictionTimestamps()) {
      times.add(new SeriesPoint(t, 0d));
    }
    cmd.add("--timeStampFile=" + writeCsv(workDir.resolve("prediction-times.csv"), times, zone));
    cmd.add("--outputBaselineFile=" + workDir.resolve("baseline.csv"));
    cmd.add("--errorStatisticsFile=" + workDir.resolve("error-stats.csv"));
    cmd.add("--timescaleDays=" + request.weightingDays());
    cmd.add("--intervalMinutes=" + request.intervalMinutes());

    if (request.hasTemperature()) {
      cmd.add("--temperatureFile="
          + writeCsv(workDir.resolve("temperature.csv"), request.trainingTemperature(), zone));
      boolean fahrenheit = Boolean.TRUE.equals(request.fahrenheit());
      cmd.add("--fahrenheit=" + String.valueOf(fahrenheit).toUpperCase(Locale.ROOT));
      if (request.forecastTemperature() != null) {
        cmd.add("--predictTemperatureFile=" + writeCsv(
            workDir.resolve("forecast-temperature.csv"), request.forecastTemperature(), zone));
      }
    }
    return cmd;
  }

  private String run(List<String> cmd, Path workDir) throws IOException {
    Path stdout = workDir.resolve("stdout.log");
    Path stderr = workDir.resolve("stderr.log");
    log.info("Running baseline script: {}", String.join(" ", cmd));

    Process process = new ProcessBuilder(cmd)
        .directory(workDir.toFile())
        .redirectOutput(stdout.toFile())
        .redirectError(stderr.toFile())
        .start();
    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ModelingServiceException("Interrupted while waiting for baseline script", "", ex);
    }

    String out = Files.readString(stdout, StandardCharsets.UTF_8);
    String err = Files.readString(stderr, StandardCharsets.UTF_8);
    out.lines().forEach(line -> log.info(" --> {}", line));
    err.lines().forEach(line -> log.warn(" --> {}", line));
    String diagnostics = (err + System.lineSeparator() + out).strip();

    if (!finished) {
      process.destroyForcibly();
      throw new ModelingServiceException(
          "Baseline script timed out after " + timeout.toSeconds() + "s", diagnostics);
    }
    if (process.exitValue() != 0) {
      throw new ModelingServiceException(
          "Baseline script exited with status " + process.exitValue(), diagnostics);
    }
    return diagnostics;
  }

  private BaselineResponse readResults(Path workDir, ZoneId zone, String diagnostics) {
    Path baselineFile = workDir.resolve("baseline.csv");
    Path statsFile = workDir.resolve("error-stats.csv");
    try (Reader baseline = Files.newBufferedReader(baselineFile, StandardCharsets.UTF_8);
        Reader stats = Files.newBufferedReader(statsFile, StandardCharsets.UTF_8)) {
      Series predicted = Series.builder()
          .csv(baseline)
          .zone(zone)
          .validation(Validation.LENIENT)
          .build();
      return new BaselineResponse(predicted.points(), readErrorStats(stats));
    } catch (IOException | UncheckedIOException ex) {
      throw new ModelingServiceException(
          "Baseline script produced no readable output: " + ex.getMessage(), diagnostics, ex);
    } catch (InvalidTimestampException ex) {
      throw new ModelingServiceException(
          "Baseline script output is malformed: " + ex.getMessage(), diagnostics, ex);
    }
  }

  static Map<String, Double> readErrorStats(Reader reader) throws IOException {
    Map<String, Double> stats = new LinkedHashMap<>();
    try (MappingIterator<String[]> rows = CSV.readerFor(String[].class).readValues(reader)) {
      while (rows.hasNext()) {
        String[] row = rows.next();
        if (row.length < 2 || row[0].isBlank()) {
          continue;
        }
        try {
          stats.put(row[0].trim().toLowerCase(Locale.ROOT), Double.parseDouble(row[1].trim()));
        } catch (NumberFormatException ex) {
          throw new ModelingServiceException(
              "Unreadable error statistic '" + row[0] + "': " + row[1], "", ex);
        }
      }
    }
    return stats;
  }

  private static Path writeCsv(Path file, List<SeriesPoint> points, ZoneId zone)
      throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      SeriesCsvWriter.write(points, zone, writer);
    }
    return file;
  }

  private static void deleteQuietly(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.deleteIfExists(path);
        } catch (IOException ex) {
          log.warn("Unable to delete {}: {}", path, ex.getMessage());
        }
      });
    } catch (IOException ex) {
      log.warn("Unable to clean up {}: {}", dir, ex.getMessage());
    }
  }
}
