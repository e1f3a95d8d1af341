package com.ospicorp.loadshape.profile;

/**
 * Options for {@link LoadProfile#baseline(BaselineParameters)}. Null bounds default to the span
 * of the training load.
 *
 * @param startAt first prediction timestamp, any normalizable form
 * @param endAt last prediction timestamp (inclusive)
 * @param weightingDays recency timescale handed to the model
 * @param modelingInterval model interval in seconds
 * @param stepSize spacing of the predicted baseline in seconds
 */
public record BaselineParameters(
    Object startAt,
    Object endAt,
    int weightingDays,
    long modelingInterval,
    long stepSize
) {
  public static final int DEFAULT_WEIGHTING_DAYS = 14;
  public static final long DEFAULT_INTERVAL_SECONDS = 900L;

  public static BaselineParameters defaults() {
    return new BaselineParameters(null, null, DEFAULT_WEIGHTING_DAYS, DEFAULT_INTERVAL_SECONDS,
        DEFAULT_INTERVAL_SECONDS);
  }
}
