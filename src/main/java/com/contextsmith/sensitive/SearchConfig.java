package com.contextsmith.sensitive;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.sensitive.dfa.DfaBuilder;
import com.contextsmith.sensitive.dfa.Searcher;
import com.contextsmith.sensitive.utils.FileUtil;

/**
 * Settings for building and searching. Each key is looked up in the
 * environment (upper-cased, dots and dashes turned into underscores), then in
 * the JVM system properties, then in {@value #CONFIG_PROP_FILE}.
 */
public class SearchConfig {
  private static final Logger log = LoggerFactory.getLogger(SearchConfig.class);

  public static final String CONFIG_PROP_FILE = "sensitive-search.properties";

  public static final String CAPACITY_KEY = "dfa.capacity";
  public static final String MAX_MATCHES_KEY = "search.max-matches";
  public static final String WORDS_PATH_KEY = "words.path";

  public static final int DEFAULT_MAX_MATCHES = 20;
  public static final String DEFAULT_WORDS_PATH = "sensitive_words.json";

  public static SearchConfig load() throws IOException {
    return load(CONFIG_PROP_FILE);
  }

  public static SearchConfig load(String filename) throws IOException {
    Properties prop = new Properties();
    if (FileUtil.exists(filename)) {
      prop = FileUtil.loadProperties(filename);
    } else {
      log.info("No {} found, using defaults", filename);
    }
    return fromProperties(prop);
  }

  public static SearchConfig fromProperties(Properties prop) {
    checkNotNull(prop);
    int capacity = parseInt(CAPACITY_KEY, lookup(CAPACITY_KEY, prop),
                            DfaBuilder.DEFAULT_CAPACITY);
    int maxMatches = parseInt(MAX_MATCHES_KEY, lookup(MAX_MATCHES_KEY, prop),
                              DEFAULT_MAX_MATCHES);
    String wordsPath = StringUtils.defaultIfBlank(
        lookup(WORDS_PATH_KEY, prop), DEFAULT_WORDS_PATH);
    return new SearchConfig(capacity, maxMatches, wordsPath);
  }

  static String toEnvName(String key) {
    return key.toUpperCase(Locale.ROOT).replaceAll("[.\\-]", "_");
  }

  private static String lookup(String key, Properties prop) {
    return Stream.of(System.getenv(toEnvName(key)), System.getProperty(key),
                     prop.getProperty(key))
        .filter(StringUtils::isNotBlank)
        .map(String::trim)
        .findFirst()
        .orElse(null);
  }

  private static int parseInt(String key, String value, int defaultValue) {
    if (value == null) return defaultValue;
    checkArgument(NumberUtils.isDigits(value),
                  "Expected a non-negative integer for %s, got '%s'", key, value);
    return Integer.parseInt(value);
  }

  private final int capacity;
  private final int maxMatches;
  private final String wordsPath;

  public SearchConfig(int capacity, int maxMatches, String wordsPath) {
    checkArgument(capacity >= 1, "Capacity must be positive: %s", capacity);
    checkArgument(maxMatches >= 0 && maxMatches <= Searcher.MAX_SEARCH_COUNT,
                  "Max matches should be within 0 and %s, got %s",
                  Searcher.MAX_SEARCH_COUNT, maxMatches);
    this.capacity = capacity;
    this.maxMatches = maxMatches;
    this.wordsPath = checkNotNull(wordsPath);
  }

  public int getCapacity() {
    return this.capacity;
  }

  public int getMaxMatches() {
    return this.maxMatches;
  }

  public String getWordsPath() {
    return this.wordsPath;
  }

  @Override
  public String toString() {
    return String.format("SearchConfig{capacity=%d, maxMatches=%d, wordsPath=%s}",
                         this.capacity, this.maxMatches, this.wordsPath);
  }
}
