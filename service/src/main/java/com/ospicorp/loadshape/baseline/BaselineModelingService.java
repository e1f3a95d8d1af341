package com.ospicorp.loadshape.baseline;

/**
 * Port to whatever fits the weather-normalized baseline model. Implementations make one blocking
 * call per request and never retry; failures surface as
 * {@link com.ospicorp.loadshape.exception.ModelingServiceException}.
 */
public interface BaselineModelingService {

  BaselineResponse predict(BaselineRequest request);
}
