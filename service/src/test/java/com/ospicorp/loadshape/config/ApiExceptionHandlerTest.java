package com.ospicorp.loadshape.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.loadshape.exception.EmptySeriesException;
import com.ospicorp.loadshape.exception.InsufficientDataException;
import com.ospicorp.loadshape.exception.ModelingServiceException;
import com.ospicorp.loadshape.exception.TariffFormatException;
import com.ospicorp.loadshape.exception.ZeroBaselineException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ApiExceptionHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void mapsDomainErrorsToStatuses() {
    assertThat(ApiExceptionHandler.statusFor(new ModelingServiceException("down", "")))
        .isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(ApiExceptionHandler.statusFor(new EmptySeriesException("empty")))
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(ApiExceptionHandler.statusFor(new InsufficientDataException("one point")))
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(ApiExceptionHandler.statusFor(new TariffFormatException("no rates")))
        .isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(ApiExceptionHandler.statusFor(new ZeroBaselineException("kwh_base")))
        .isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void invalidRequestReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/load-profiles/baseline",
        HttpMethod.POST,
        new HttpEntity<>(Map.of("timezone", "UTC", "load", List.of())),
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body).containsEntry("type", "https://docs.loadshape.dev/problems/invalid-parameter");
  }

  @Test
  void unknownTimezoneIsBadRequest() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/load-profiles/baseline",
        HttpMethod.POST,
        new HttpEntity<>(Map.of("timezone", "Mars/Olympus_Mons",
            "load", List.of(List.of(1379462400, 10)))),
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("status", 400);
  }

  @Test
  void unknownPathIsNotFound() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/nothing-here",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void wrongMethodIsNotAllowed() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/load-profiles/diff",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
  }
}
