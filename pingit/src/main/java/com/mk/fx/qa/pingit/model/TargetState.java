package com.mk.fx.qa.pingit.model;

/** Health of a target as seen by its aggregator. */
public enum TargetState {
  UNKNOWN,
  UP,
  DOWN;

  /** Numeric status as stored in the statistics table, {@code null} while unknown. */
  public Integer toStatusCode() {
    return switch (this) {
      case UP -> 1;
      case DOWN -> 0;
      case UNKNOWN -> null;
    };
  }

  /** Inverse of {@link #toStatusCode()}. */
  public static TargetState fromStatusCode(Integer code) {
    if (code == null) {
      return UNKNOWN;
    }
    return code == 1 ? UP : DOWN;
  }
}
