package com.ospicorp.loadshape.api;

import com.ospicorp.loadshape.api.dto.BaselineResult;
import com.ospicorp.loadshape.api.dto.CostResponse;
import com.ospicorp.loadshape.api.dto.DiffResponse;
import com.ospicorp.loadshape.api.dto.LoadProfileRequest;
import com.ospicorp.loadshape.api.dto.SeriesResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/load-profiles")
@Validated
@Tag(name = "Load profiles")
public class LoadProfileController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;
  private static final String ERROR_DOCS_BASE = "https://docs.loadshape.dev/errors/";

  private final LoadProfileService service;

  public LoadProfileController(LoadProfileService service) {
    this.service = service;
  }

  @PostMapping("/baseline")
  @Operation(summary = "Fit a baseline",
      description = "Predict the load the building would have drawn, with the model's error statistics.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Baseline points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = BaselineResult.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "502", description = "Baseline model failed",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> baseline(@Valid @RequestBody LoadProfileRequest request,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    BaselineResult result = service.baseline(request);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? result.baseline() : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping("/diff")
  @Operation(summary = "Actual minus baseline",
      description = "Interval-average kW difference and baseline with cumulative kWh totals.")
  public DiffResponse diff(@Valid @RequestBody LoadProfileRequest request) {
    return service.diff(request);
  }

  @PostMapping("/event-performance")
  @Operation(summary = "Event performance",
      description = "Shed, energy reduction and savings over window.start_at..window.end_at.")
  public Map<String, Double> eventPerformance(@Valid @RequestBody LoadProfileRequest request) {
    return service.eventPerformance(request);
  }

  @PostMapping("/cumulative-sum")
  @Operation(summary = "Cumulative kWh difference")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Cumulative kWh points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = SeriesResponse.class)),
              @Content(mediaType = "text/csv")
          })
  })
  public ResponseEntity<?> cumulativeSum(@Valid @RequestBody LoadProfileRequest request,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    SeriesResponse result = service.cumulativeSum(request);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? result.points() : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping("/cost")
  @Operation(summary = "Energy cost of the metered load under the supplied tariff")
  public CostResponse cost(@Valid @RequestBody LoadProfileRequest request) {
    return service.cost(request);
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
