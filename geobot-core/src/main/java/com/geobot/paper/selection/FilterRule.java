package com.geobot.paper.selection;

public enum FilterRule {
  VOLUME_OUT_OF_RANGE,
  DEADLINE_TOO_SOON,
  DEADLINE_TOO_FAR,
  SERIES_EXCLUDED,
  DEAD_ZONE,
  PRICE_OUTSIDE_ZONE,
  CLUSTER_NOT_ALLOWED,
  MISSING_TOKEN
}
