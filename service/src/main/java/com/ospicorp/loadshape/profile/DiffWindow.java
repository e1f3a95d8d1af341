package com.ospicorp.loadshape.profile;

/**
 * Output grid for diff, cumulative sum and cost reads. When {@code stepCount} is set it wins over
 * {@code stepSize}.
 */
public record DiffWindow(Object startAt, Object endAt, long stepSize, Integer stepCount) {
  public static final long DEFAULT_STEP_SECONDS = 900L;

  public static DiffWindow all() {
    return new DiffWindow(null, null, DEFAULT_STEP_SECONDS, null);
  }

  public static DiffWindow stepped(Object startAt, Object endAt, long stepSize) {
    return new DiffWindow(startAt, endAt, stepSize, null);
  }

  public static DiffWindow counted(Object startAt, Object endAt, int stepCount) {
    return new DiffWindow(startAt, endAt, DEFAULT_STEP_SECONDS, stepCount);
  }
}
