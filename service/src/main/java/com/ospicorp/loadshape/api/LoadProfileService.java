package com.ospicorp.loadshape.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.loadshape.api.dto.BaselineOptions;
import com.ospicorp.loadshape.api.dto.BaselineResult;
import com.ospicorp.loadshape.api.dto.CostResponse;
import com.ospicorp.loadshape.api.dto.DemandResponseDates;
import com.ospicorp.loadshape.api.dto.DiffResponse;
import com.ospicorp.loadshape.api.dto.ExclusionWindow;
import com.ospicorp.loadshape.api.dto.LoadProfileRequest;
import com.ospicorp.loadshape.api.dto.PointDto;
import com.ospicorp.loadshape.api.dto.SeriesResponse;
import com.ospicorp.loadshape.api.dto.WindowOptions;
import com.ospicorp.loadshape.baseline.BaselineModelingService;
import com.ospicorp.loadshape.profile.BaselineParameters;
import com.ospicorp.loadshape.profile.DiffWindow;
import com.ospicorp.loadshape.profile.LoadProfile;
import com.ospicorp.loadshape.series.model.RawReading;
import com.ospicorp.loadshape.series.model.TemperatureUnits;
import com.ospicorp.loadshape.series.service.ExclusionCalendars;
import com.ospicorp.loadshape.series.service.Series;
import com.ospicorp.loadshape.series.service.TimestampNormalizer;
import com.ospicorp.loadshape.tariff.Tariff;
import com.ospicorp.loadshape.tariff.TariffCostModel;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Builds a fresh {@link LoadProfile} from each request and runs one operation on it.
 */
@Service
public class LoadProfileService {
  private static final Logger log = LoggerFactory.getLogger(LoadProfileService.class);

  private final BaselineModelingService modelingService;
  private final TariffCostModel costModel;
  private final ExclusionCalendars calendars;
  private final ObjectMapper mapper;
  private final String defaultTimezone;

  public LoadProfileService(BaselineModelingService modelingService, TariffCostModel costModel,
      ExclusionCalendars calendars, ObjectMapper mapper,
      @Value("${loadshape.default-timezone:}") String defaultTimezone) {
    this.modelingService = modelingService;
    this.costModel = costModel;
    this.calendars = calendars;
    this.mapper = mapper;
    this.defaultTimezone = defaultTimezone;
  }

  public BaselineResult baseline(LoadProfileRequest request) {
    LoadProfile profile = build(request);
    Series baseline = profile.baseline(baselineParameters(request.baseline()));
    return new BaselineResult(profile.zone().getId(), PointDto.of(baseline),
        profile.errorStats());
  }

  public DiffResponse diff(LoadProfileRequest request) {
    LoadProfile profile = buildAndBaseline(request);
    return DiffResponse.of(profile.diff(diffWindow(request.window())));
  }

  public Map<String, Double> eventPerformance(LoadProfileRequest request) {
    WindowOptions window = request.window();
    if (window == null || window.startAt() == null || window.endAt() == null) {
      throw new IllegalArgumentException("event performance needs window.start_at and window.end_at");
    }
    LoadProfile profile = buildAndBaseline(request);
    return profile.eventPerformance(window.startAt(), window.endAt());
  }

  public SeriesResponse cumulativeSum(LoadProfileRequest request) {
    LoadProfile profile = buildAndBaseline(request);
    Series sum = profile.cumulativeSum(diffWindow(request.window()));
    return new SeriesResponse(profile.zone().getId(), PointDto.of(sum));
  }

  public CostResponse cost(LoadProfileRequest request) {
    LoadProfile profile = build(request);
    WindowOptions window = request.window();
    if (window == null) {
      return CostResponse.of(profile.cost(null, null, null, null));
    }
    return CostResponse.of(
        profile.cost(null, window.startAt(), window.endAt(), window.stepCount()));
  }

  LoadProfile build(LoadProfileRequest request) {
    ZoneId zone = resolveZone(request.timezone());
    TemperatureUnits units = TemperatureUnits.parse(request.temperatureUnits());

    Series load = series(request.load(), zone, units);
    for (ExclusionWindow exclusion : nullToEmpty(request.exclusions())) {
      load.addExclusion(exclusion.start(), exclusion.end());
    }
    for (String name : nullToEmpty(request.namedExclusions())) {
      load.addNamedExclusion(name, calendars);
    }

    Tariff tariff = null;
    if (request.tariff() != null) {
      tariff = Tariff.parse(mapper.valueToTree(request.tariff()));
      for (DemandResponseDates period : nullToEmpty(request.demandResponsePeriods())) {
        tariff.addDemandResponsePeriod(period.start(), period.end());
      }
    }

    log.debug("Built load profile: {} load points in {}, temperature={}, tariff={}",
        load.size(), zone, request.temperature() != null, tariff != null);
    return LoadProfile.builder()
        .trainingLoad(load)
        .trainingTemperature(series(request.temperature(), zone, units))
        .forecastTemperature(series(request.forecastTemperature(), zone, units))
        .floorArea(request.floorArea())
        .tariff(tariff)
        .modelingService(modelingService)
        .costModel(costModel)
        .calendars(calendars)
        .build();
  }

  // an explicit baseline block fits with those options, otherwise the profile fits defaults lazily
  private LoadProfile buildAndBaseline(LoadProfileRequest request) {
    LoadProfile profile = build(request);
    if (request.baseline() != null) {
      profile.baseline(baselineParameters(request.baseline()));
    }
    return profile;
  }

  private ZoneId resolveZone(String timezone) {
    if (StringUtils.hasText(timezone)) {
      return TimestampNormalizer.resolveZone(timezone);
    }
    return TimestampNormalizer.resolveZone(defaultTimezone);
  }

  private static Series series(List<List<Object>> rows, ZoneId zone, TemperatureUnits units) {
    if (rows == null) {
      return null;
    }
    List<RawReading> readings = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row == null || row.isEmpty()) {
        throw new IllegalArgumentException("readings must be [timestamp, value] pairs");
      }
      readings.add(new RawReading(row.get(0), row.size() > 1 ? row.get(1) : null));
    }
    return Series.builder()
        .readings(readings)
        .zone(zone)
        .temperatureUnits(units)
        .build();
  }

  private static BaselineParameters baselineParameters(BaselineOptions options) {
    BaselineParameters defaults = BaselineParameters.defaults();
    if (options == null) {
      return defaults;
    }
    return new BaselineParameters(
        options.startAt(),
        options.endAt(),
        options.weightingDays() != null ? options.weightingDays() : defaults.weightingDays(),
        options.modelingInterval() != null
            ? options.modelingInterval()
            : defaults.modelingInterval(),
        options.stepSize() != null ? options.stepSize() : defaults.stepSize());
  }

  private static DiffWindow diffWindow(WindowOptions options) {
    if (options == null) {
      return DiffWindow.all();
    }
    long stepSize = options.stepSize() != null
        ? options.stepSize()
        : DiffWindow.DEFAULT_STEP_SECONDS;
    return new DiffWindow(options.startAt(), options.endAt(), stepSize, options.stepCount());
  }

  private static <T> List<T> nullToEmpty(List<T> values) {
    return values == null ? List.of() : values;
  }
}
