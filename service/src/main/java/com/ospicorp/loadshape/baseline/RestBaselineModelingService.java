package com.ospicorp.loadshape.baseline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ospicorp.loadshape.exception.ModelingServiceException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls a remote baseline model over HTTP. The model answers
 * {@code {"baseline": [[ts, kW], ...], "error_stats": {"name": value}}}.
 */
@Service
@ConditionalOnProperty(name = "loadshape.baseline.mode", havingValue = "rest")
public class RestBaselineModelingService implements BaselineModelingService {
  private static final Logger log = LoggerFactory.getLogger(RestBaselineModelingService.class);

  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final String baseUrl;

  public RestBaselineModelingService(RestTemplate restTemplate, ObjectMapper mapper,
      @Value("${loadshape.baseline.rest.url:http://baseline-model:8000}") String baseUrl) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  @Override
  public BaselineResponse predict(BaselineRequest request) {
    String url = baseUrl + "/baseline";
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    HttpEntity<ObjectNode> entity = new HttpEntity<>(buildBody(request), headers);

    ResponseEntity<JsonNode> response;
    try {
      log.info("Requesting baseline from {} ({} training points, {} predictions)", url,
          request.trainingLoad().size(), request.predictionTimestamps().size());
      response = restTemplate.exchange(url, HttpMethod.POST, entity, JsonNode.class);
    } catch (HttpStatusCodeException ex) {
      throw new ModelingServiceException(
          "Baseline service returned status " + ex.getStatusCode().value(),
          ex.getResponseBodyAsString(), ex);
    } catch (RestClientException ex) {
      throw new ModelingServiceException("Baseline service call failed: " + ex.getMessage(), "",
          ex);
    }
    return toResponse(response.getBody());
  }

  private ObjectNode buildBody(BaselineRequest request) {
    ObjectNode body = mapper.createObjectNode();
    body.set("load", points(request.trainingLoad()));
    ArrayNode times = body.putArray("prediction_timestamps");
    request.predictionTimestamps().forEach(times::add);
    if (request.hasTemperature()) {
      body.set("temperature", points(request.trainingTemperature()));
      body.put("fahrenheit", Boolean.TRUE.equals(request.fahrenheit()));
      if (request.forecastTemperature() != null) {
        body.set("forecast_temperature", points(request.forecastTemperature()));
      }
    }
    body.put("weighting_days", request.weightingDays());
    body.put("interval_minutes", request.intervalMinutes());
    body.put("timezone", request.zone().getId());
    return body;
  }

  private ArrayNode points(List<SeriesPoint> points) {
    ArrayNode out = mapper.createArrayNode();
    for (SeriesPoint p : points) {
      out.addArray().add(p.timestamp()).add(p.value());
    }
    return out;
  }

  private BaselineResponse toResponse(JsonNode body) {
    if (body == null || !body.path("baseline").isArray()) {
      throw new ModelingServiceException("Baseline service response missing 'baseline'",
          String.valueOf(body));
    }
    List<SeriesPoint> predictions = new ArrayList<>();
    for (JsonNode row : body.get("baseline")) {
      if (!row.isArray() || row.size() < 2 || !row.get(0).canConvertToLong()) {
        throw new ModelingServiceException("Malformed baseline row: " + row, body.toString());
      }
      JsonNode value = row.get(1);
      if (value.isNumber()) {
        predictions.add(new SeriesPoint(row.get(0).asLong(), value.asDouble()));
      }
    }
    Map<String, Double> stats = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = body.path("error_stats").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      stats.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asDouble());
    }
    return new BaselineResponse(predictions, stats);
  }
}
