package com.geobot.paper.selection;

/**
 * Why a raw market did not become a {@link Candidate}, in the order the checks run.
 */
public enum RejectReason {
  NOT_GEOPOLITICAL,
  MISSING_TIMESTAMPS,
  TOO_SOON_AFTER_OPEN,
  TOO_CLOSE_TO_END,
  INVALID_PRICE,
  MISSING_ID
}
