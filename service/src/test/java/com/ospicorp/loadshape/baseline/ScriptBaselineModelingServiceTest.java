package com.ospicorp.loadshape.baseline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.loadshape.exception.ModelingServiceException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ScriptBaselineModelingServiceTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
  private static final long START = 1381561200L;

  @TempDir
  Path scripts;

  private Path script;

  @BeforeEach
  void copyScript() throws IOException {
    script = scripts.resolve("fake-baseline.sh");
    try (InputStream in = getClass().getResourceAsStream("/scripts/fake-baseline.sh")) {
      Files.copy(in, script);
    }
  }

  private ScriptBaselineModelingService service(String extraArgs, long timeoutSeconds) {
    return new ScriptBaselineModelingService("sh " + script + " " + extraArgs, timeoutSeconds);
  }

  private static List<SeriesPoint> load() {
    return List.of(
        new SeriesPoint(START, 10d),
        new SeriesPoint(START + 900, 12d),
        new SeriesPoint(START + 1800, 11d));
  }

  @Test
  void readsPredictionsAndErrorStats() {
    var request = new BaselineRequest(load(), null, null, List.of(START, START + 900, START + 1800),
        null, 14, 15, LA);

    var response = service("", 30).predict(request);

    assertThat(response.predictions()).extracting(SeriesPoint::timestamp)
        .containsExactly(START, START + 900, START + 1800);
    assertThat(response.predictions()).extracting(SeriesPoint::value)
        .containsOnly(42d);
    assertEquals(1.5, response.errorStats().get("rmse"));
    assertEquals(12.25, response.errorStats().get("cvrmse"));
    assertEquals(14d, response.errorStats().get("timescaledays"));
    assertEquals(15d, response.errorStats().get("intervalminutes"));
    assertEquals(0d, response.errorStats().get("temperature"));
  }

  @Test
  void passesTemperatureFilesWhenPresent() {
    var temperature = List.of(new SeriesPoint(START, 61d), new SeriesPoint(START + 1800, 63d));
    var request = new BaselineRequest(load(), temperature, false, List.of(START), temperature,
        7, 60, LA);

    var stats = service("", 30).predict(request).errorStats();

    assertEquals(1d, stats.get("temperature"));
    assertEquals(1d, stats.get("forecast"));
    assertEquals(60d, stats.get("intervalminutes"));
  }

  @Test
  void nonZeroExitCarriesStderr() {
    var request = new BaselineRequest(load(), null, null, List.of(START), null, 14, 15, LA);

    var ex = assertThrows(ModelingServiceException.class,
        () -> service("--fail=singular-matrix", 30).predict(request));

    assertThat(ex.getMessage()).contains("status 3");
    assertThat(ex.diagnostics()).contains("model exploded: singular-matrix");
    assertEquals("MODELING_SERVICE", ex.errorCode());
  }

  @Test
  void emptyLoadIsReportedByTheScript() {
    var request = new BaselineRequest(List.of(), null, null, List.of(START), null, 14, 15, LA);

    var ex = assertThrows(ModelingServiceException.class, () -> service("", 30).predict(request));

    assertThat(ex.diagnostics()).contains("no load data");
  }

  @Test
  void slowScriptTimesOut() {
    var request = new BaselineRequest(load(), null, null, List.of(START), null, 14, 15, LA);

    var ex = assertThrows(ModelingServiceException.class,
        () -> service("--sleep=10", 1).predict(request));

    assertThat(ex.getMessage()).contains("timed out");
  }

  @Test
  void blankCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ScriptBaselineModelingService(" ", 5));
  }

  @Test
  void errorStatsNamesAreLowercased() throws IOException {
    Map<String, Double> stats = ScriptBaselineModelingService.readErrorStats(
        new StringReader("RMSE,2.0\n\nNMBE,-0.5\n"));

    assertEquals(Map.of("rmse", 2.0, "nmbe", -0.5), stats);
    assertThrows(ModelingServiceException.class, () -> ScriptBaselineModelingService
        .readErrorStats(new StringReader("RMSE,high\n")));
  }
}
