package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every word occurrence in a byte buffer by walking the trie from each
 * text position in turn. There are no failure transitions, so the cost is
 * bounded by text length times the longest word.
 */
public final class Searcher {

  // The result count is a 16-bit unsigned value.
  public static final int MAX_SEARCH_COUNT = 0xFFFF;

  /**
   * Scans {@code text} and returns at most {@code maxMatches} spans, ordered
   * by start offset, then end offset. Once the cap is reached the scan stops,
   * so later occurrences are dropped.
   *
   * @throws IllegalStateException if the automaton has been closed
   */
  public static SearchResult search(Dfa dfa, byte[] text, int maxMatches) {
    checkNotNull(dfa);
    checkNotNull(text);
    checkArgument(maxMatches >= 0 && maxMatches <= MAX_SEARCH_COUNT,
                  "maxMatches should be within 0 and %s, got %s.",
                  MAX_SEARCH_COUNT, maxMatches);

    NodeArena arena = dfa.getArena();
    int[] next = arena.transitions();
    long[] endMasks = arena.endMasks();
    List<MatchSpan> matches = new ArrayList<>();

    scan:
    for (int j = 0; j < text.length; ++j) {
      if (matches.size() >= maxMatches) break;

      int state = NodeArena.ROOT;
      for (int i = j; i < text.length; ++i) {
        int c = text[i] & 0xFF;
        if (c >= NodeArena.CHARSET_SIZE) break;

        int child = next[state * NodeArena.CHARSET_SIZE + c];
        if (child == NodeArena.ABSENT) break;

        if (NodeArena.isEnd(endMasks, state, c)) {
          if (matches.size() >= maxMatches) break scan;
          matches.add(new MatchSpan(j, i));
        }
        // Keep walking, a longer word may share this path.
        state = child;
      }
    }
    return new SearchResult(matches);
  }

  private Searcher() {
  }
}
