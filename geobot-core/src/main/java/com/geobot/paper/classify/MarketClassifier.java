package com.geobot.paper.classify;

/**
 * Maps market question text to a tradability verdict and a diversification cluster.
 */
public interface MarketClassifier {

  MarketClassification classify(String question);
}
