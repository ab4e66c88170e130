package com.debateleague.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String newRunId(String prefix) {
    return prefix + "-" + newTraceId();
  }
}
