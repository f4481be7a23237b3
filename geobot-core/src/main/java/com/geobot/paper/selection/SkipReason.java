package com.geobot.paper.selection;

public enum SkipReason {
  ALREADY_HELD,
  EVENT_CAP,
  TOTAL_EXPOSURE_CAP,
  CLUSTER_EXPOSURE_CAP
}
