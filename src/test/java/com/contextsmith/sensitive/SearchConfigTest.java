package com.contextsmith.sensitive;

import static org.junit.Assert.assertEquals;

import java.util.Properties;

import org.junit.After;
import org.junit.Test;

import com.contextsmith.sensitive.dfa.DfaBuilder;

public class SearchConfigTest {

  @After
  public void clearOverrides() {
    System.clearProperty(SearchConfig.MAX_MATCHES_KEY);
  }

  @Test
  public void defaultsWhenNothingIsSet() {
    SearchConfig config = SearchConfig.fromProperties(new Properties());
    assertEquals(DfaBuilder.DEFAULT_CAPACITY, config.getCapacity());
    assertEquals(SearchConfig.DEFAULT_MAX_MATCHES, config.getMaxMatches());
    assertEquals(SearchConfig.DEFAULT_WORDS_PATH, config.getWordsPath());
  }

  @Test
  public void loadsPropertiesFile() throws Exception {
    SearchConfig config = SearchConfig.load("test-search.properties");
    assertEquals(5000, config.getCapacity());
    assertEquals(7, config.getMaxMatches());
    assertEquals("words/sample.txt", config.getWordsPath());
  }

  @Test
  public void missingFileFallsBackToDefaults() throws Exception {
    SearchConfig config = SearchConfig.load("no-such-config.properties");
    assertEquals(SearchConfig.DEFAULT_MAX_MATCHES, config.getMaxMatches());
  }

  @Test
  public void systemPropertyOverridesFile() throws Exception {
    System.setProperty(SearchConfig.MAX_MATCHES_KEY, "3");
    SearchConfig config = SearchConfig.load("test-search.properties");
    assertEquals(3, config.getMaxMatches());
    assertEquals(5000, config.getCapacity());
  }

  @Test
  public void envNames() {
    assertEquals("DFA_CAPACITY", SearchConfig.toEnvName(SearchConfig.CAPACITY_KEY));
    assertEquals("SEARCH_MAX_MATCHES",
                 SearchConfig.toEnvName(SearchConfig.MAX_MATCHES_KEY));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsNonNumericCapacity() {
    Properties prop = new Properties();
    prop.setProperty(SearchConfig.CAPACITY_KEY, "lots");
    SearchConfig.fromProperties(prop);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsMaxMatchesAbove16Bits() {
    Properties prop = new Properties();
    prop.setProperty(SearchConfig.MAX_MATCHES_KEY, "65536");
    SearchConfig.fromProperties(prop);
  }
}
