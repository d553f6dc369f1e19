package com.contextsmith.sensitive.demo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.contextsmith.sensitive.SensitiveWordSearch;

public class SensitiveSearchMainTest {

  @Test
  public void parsesOptions() {
    SensitiveSearchMain.Options opts = SensitiveSearchMain.parseArgs(
        "-w", "words.txt", "--max", "5", "--text", "bad words");
    assertEquals("words.txt", opts.wordsPath);
    assertEquals("5", opts.maxMatches);
    assertEquals("bad words", opts.text);
    assertNull(opts.capacity);
  }

  @Test
  public void runReportsEachMatch() throws Exception {
    try (SensitiveWordSearch search = SensitiveWordSearch.create(
        Arrays.asList("bad", "badger"), 100)) {
      List<String> lines = SensitiveSearchMain.run(search, "a badger", 20);
      assertEquals(Arrays.asList("bad: 2 -> 5", "badger: 2 -> 8"), lines);
      assertEquals(Collections.emptyList(),
                   SensitiveSearchMain.run(search, "fine", 20));
    }
  }
}
