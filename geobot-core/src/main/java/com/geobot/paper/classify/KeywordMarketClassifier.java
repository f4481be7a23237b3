package com.geobot.paper.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword classifier for geopolitical markets.
 *
 * A question is geopolitical when it is not noise, names an entity (country, city, leader or
 * organisation) and names an action (military, diplomatic, political change, sanctions). The
 * cluster is the first region in {@link #CLUSTERS} with a keyword in the question.
 */
public class KeywordMarketClassifier implements MarketClassifier {

  /**
   * Noise keywords of this length or shorter are matched on word boundaries ("era", "ath", "heat").
   */
  private static final int SHORT_KEYWORD_LENGTH = 4;

  static final Set<String> GARBAGE_KEYWORDS = Set.of(
      // sports
      "nfl", "nba", "mlb", "nhl", "mls", "ufc", "wwe", "pga", "lpga",
      "premier league", "la liga", "serie a", "bundesliga", "ligue 1",
      "champions league", "europa league", "world cup", "euro 2024", "euro 2028",
      "super bowl", "stanley cup", "world series", "march madness",
      "touchdown", "quarterback", "rushing yards", "receiving yards",
      "rebounds", "assists", "three-pointers", "free throws",
      "home run", "strikeout", "batting average", "era",
      "goals scored", "clean sheet", "penalty kick", "yellow card",
      "knockout", "submission", "tale of the tape", "weigh-in",
      "tennis", "wimbledon", "us open", "french open", "australian open",
      "golf", "masters", "pga championship", "the open",
      "f1", "formula 1", "nascar", "indycar", "motogp",
      "olympics", "paralympics", "medal count",
      "esports", "counter-strike", "valorant", "league of legends", "dota",
      "fortnite", "call of duty", "overwatch",
      "lakers", "celtics", "warriors", "heat", "bulls", "knicks", "nets",
      "cowboys", "patriots", "chiefs", "eagles", "packers",
      "bulldogs", "crimson tide", "buckeyes", "wolverines",
      "yankees", "dodgers", "red sox", "cubs",
      // crypto prices
      "bitcoin price", "btc price", "ethereum price", "eth price",
      "solana price", "sol price", "crypto price", "token price",
      "memecoin", "meme coin", "nft drop", "airdrop",
      "all time high", "ath", "market cap",
      // entertainment
      "movie", "film release", "box office", "netflix", "disney+", "hbo",
      "album drop", "song", "grammy", "emmy", "oscar", "golden globe",
      "taylor swift", "drake album", "kanye", "kardashian",
      "bachelor", "bachelorette", "survivor", "big brother",
      "youtube subscribers", "tiktok followers", "twitch",
      "streamer", "influencer",
      // gaming
      "speedrun", "world record gaming", "video game release",
      // natural events
      "earthquake magnitude", "hurricane category", "tornado",
      "tsunami warning", "volcano eruption"
  );

  private static final List<Pattern> GARBAGE_PATTERNS = List.of(
      Pattern.compile("\\b(nba|nfl|mlb|nhl|ufc|mma)\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(rebounds?|assists?|touchdowns?|strikeouts?)\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bover/under\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bo/u\\s*\\d", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(spread|moneyline|parlay)\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bvs\\.?\\s+[a-z]+\\s+(heat|lakers|warriors|celtics|bulls)", Pattern.CASE_INSENSITIVE)
  );

  static final Set<String> WORD_BOUNDARY_ENTITIES = Set.of(
      "us", "uk", "eu", "un", "uae",
      "iran", "iraq", "cuba", "gaza", "mali", "chad",
      "nato", "idf", "cia", "fbi", "gru", "fsb", "sdf",
      "assad", "modi"
  );

  static final Set<String> ENTITIES = Set.of(
      "russia", "russian", "ukraine", "ukrainian", "china", "chinese",
      "taiwan", "taiwanese", "israel", "israeli", "palestine", "palestinian",
      "venezuela", "venezuelan", "syria", "syrian", "lebanon", "lebanese",
      "north korea", "south korea", "korean",
      "afghanistan", "pakistan", "pakistani", "saudi", "yemen", "yemeni",
      "turkey", "turkish", "egypt", "egyptian", "libya", "libyan",
      "belarus", "belarusian", "crimea", "crimean",
      "mexico", "mexican", "colombia", "colombian",
      "japan", "japanese", "philippines", "filipino",
      "vietnam", "vietnamese", "myanmar", "burma",
      "india", "indian", "kashmir",
      "sudan", "sudanese", "ethiopia", "ethiopian", "somalia", "somalian",
      "kyiv", "kiev", "kharkiv", "mariupol", "bakhmut", "pokrovsk",
      "moscow", "beijing", "taipei", "tehran", "damascus", "beirut",
      "jerusalem", "tel aviv", "gaza city", "rafah",
      "caracas", "pyongyang", "seoul", "kabul", "islamabad",
      "putin", "zelensky", "zelenskyy", "khamenei", "netanyahu",
      "xi jinping", "kim jong", "maduro", "erdogan", "lukashenko",
      "lavrov", "shoigu", "nasrallah", "sinwar", "gallant",
      "hamas", "hezbollah", "houthi", "houthis", "taliban", "wagner",
      "irgc", "mossad", "kremlin", "pentagon",
      "united nations", "security council", "european union"
  );

  static final Set<String> ACTIONS = Set.of(
      // military
      "invasion", "invade", "invaded", "invades",
      "strike", "strikes", "struck", "airstrike", "air strike",
      "missile", "drone strike", "bombing", "bomb", "bombed",
      "attack", "attacked", "attacks", "offensive",
      "capture", "captured", "captures", "seize", "seized",
      "advance", "advancing", "retreat", "retreating",
      "counteroffensive", "counter-offensive",
      "occupy", "occupied", "occupation",
      "annex", "annexed", "annexation",
      "blockade", "siege", "encircle",
      "deploy", "deployed", "deployment",
      "shell", "shelling", "artillery",
      "clash", "clashes", "clashed",
      // diplomacy
      "ceasefire", "cease-fire", "truce", "armistice",
      "peace deal", "peace treaty", "peace talks", "peace agreement",
      "negotiate", "negotiation", "negotiations",
      "summit", "diplomatic talks",
      "disarm", "disarmament",
      // political change
      "regime change", "regime fall", "fall of",
      "coup", "uprising", "revolution", "revolt",
      "resign", "resigns", "resignation",
      "oust", "ousted", "topple", "toppled", "overthrow",
      "assassinate", "assassination",
      // sanctions
      "sanctions", "sanction", "sanctioned",
      "embargo", "embargoed",
      "tariff", "tariffs",
      // escalation
      "escalation", "escalate", "escalates",
      "nuclear", "atomic", "warhead",
      "war", "warfare", "conflict",
      // humanitarian
      "casualties", "killed", "deaths",
      "hostage", "hostages", "prisoner",
      "war crime", "genocide", "atrocity",
      // leadership status ("X out as leader by ...")
      "out as", "out by", "removed as", "no longer",
      "president", "prime minister", "leader",
      "remain", "remains"
  );

  static final Map<String, List<String>> CLUSTERS = clusters();

  private final List<Pattern> shortGarbagePatterns;
  private final List<String> longGarbageKeywords;
  private final List<Pattern> entityPatterns;

  public KeywordMarketClassifier() {
    this.shortGarbagePatterns = GARBAGE_KEYWORDS.stream()
        .filter(kw -> kw.length() <= SHORT_KEYWORD_LENGTH)
        .map(KeywordMarketClassifier::wordPattern)
        .toList();
    this.longGarbageKeywords = GARBAGE_KEYWORDS.stream()
        .filter(kw -> kw.length() > SHORT_KEYWORD_LENGTH)
        .toList();
    this.entityPatterns = WORD_BOUNDARY_ENTITIES.stream()
        .map(KeywordMarketClassifier::wordPattern)
        .toList();
  }

  private static Map<String, List<String>> clusters() {
    Map<String, List<String>> m = new LinkedHashMap<>();
    m.put("ukraine", List.of(
        "ukraine", "ukrainian", "kyiv", "kiev", "kharkiv", "mariupol",
        "bakhmut", "pokrovsk", "zelensky", "zelenskyy", "crimea",
        // most Russia markets are about the war in Ukraine
        "russia", "russian", "putin", "moscow", "kremlin"));
    m.put("mideast", List.of(
        "israel", "israeli", "gaza", "palestine", "palestinian",
        "iran", "iranian", "tehran", "khamenei",
        "lebanon", "lebanese", "beirut", "hezbollah", "nasrallah",
        "syria", "syrian", "damascus", "assad",
        "yemen", "yemeni", "houthi", "houthis",
        "iraq", "iraqi", "baghdad",
        "netanyahu", "gallant", "idf", "hamas", "sinwar"));
    m.put("china", List.of(
        "china", "chinese", "beijing", "xi jinping",
        "taiwan", "taiwanese", "taipei",
        "south china sea", "taiwan strait"));
    m.put("latam", List.of(
        "venezuela", "venezuelan", "caracas", "maduro",
        "cuba", "cuban", "havana",
        "mexico", "mexican",
        "colombia", "colombian"));
    m.put("europe", List.of(
        "nato", "european union",
        "uk ", "u.k.", "britain", "british",
        "france", "french", "macron",
        "germany", "german", "scholz",
        "poland", "polish"));
    m.put("africa", List.of(
        "sudan", "sudanese", "khartoum",
        "ethiopia", "ethiopian",
        "somalia", "somalian", "mogadishu",
        "libya", "libyan", "tripoli",
        "nigeria", "nigerian"));
    return Collections.unmodifiableMap(m);
  }

  private static Pattern wordPattern(String keyword) {
    return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
  }

  @Override
  public MarketClassification classify(String question) {
    if (question == null || question.isBlank()) {
      return MarketClassification.garbage();
    }
    String q = question.toLowerCase(Locale.ROOT);
    if (isGarbage(q)) {
      return MarketClassification.garbage();
    }
    boolean geo = hasEntity(q) && hasAction(q);
    return new MarketClassification(true, geo, geo ? cluster(q) : MarketClassification.OTHER);
  }

  boolean isGarbage(String q) {
    for (String kw : longGarbageKeywords) {
      if (q.contains(kw)) {
        return true;
      }
    }
    for (Pattern p : shortGarbagePatterns) {
      if (p.matcher(q).find()) {
        return true;
      }
    }
    for (Pattern p : GARBAGE_PATTERNS) {
      if (p.matcher(q).find()) {
        return true;
      }
    }
    return false;
  }

  private boolean hasEntity(String q) {
    for (Pattern p : entityPatterns) {
      if (p.matcher(q).find()) {
        return true;
      }
    }
    for (String kw : ENTITIES) {
      if (q.contains(kw)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasAction(String q) {
    for (String kw : ACTIONS) {
      if (q.contains(kw)) {
        return true;
      }
    }
    return false;
  }

  static String cluster(String q) {
    for (Map.Entry<String, List<String>> e : CLUSTERS.entrySet()) {
      for (String kw : e.getValue()) {
        if (q.contains(kw)) {
          return e.getKey();
        }
      }
    }
    return MarketClassification.OTHER;
  }
}
