package com.geobot.paper.classify;

/**
 * @param capturable false for obvious noise (sports, crypto prices, entertainment)
 * @param geopolitical true when the question names a geopolitical entity and a geopolitical action
 * @param cluster region label used for exposure caps; {@code "other"} when nothing matched
 */
public record MarketClassification(boolean capturable, boolean geopolitical, String cluster) {

  public static final String OTHER = "other";

  public static MarketClassification garbage() {
    return new MarketClassification(false, false, OTHER);
  }
}
