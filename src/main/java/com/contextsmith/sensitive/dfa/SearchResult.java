package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * <p>Holds the outcome of one scan: whether anything was found and the
 * matched spans, ordered by start offset, then end offset.</p>
 */
public class SearchResult {
  private final List<MatchSpan> matches;

  SearchResult(List<MatchSpan> matches) {
    this.matches = ImmutableList.copyOf(matches);
  }

  /**
   * Returns the bytes of {@code text} covered by the span at {@code index}.
   * {@code text} must be the buffer that was scanned.
   */
  public byte[] getMatchedBytes(byte[] text, int index) {
    checkNotNull(text);
    MatchSpan span = this.matches.get(index);
    return Arrays.copyOfRange(text, span.getStart(), span.getEnd() + 1);
  }

  public List<MatchSpan> getMatches() {
    return this.matches;
  }

  public boolean isFound() {
    return !this.matches.isEmpty();
  }

  public int size() {
    return this.matches.size();
  }

  /**
   * Returns the spans flattened into {@code [start0, end0, start1, end1, ...]}.
   */
  public int[] toOffsetArray() {
    int[] offsets = new int[this.matches.size() * 2];
    for (int i = 0; i < this.matches.size(); ++i) {
      MatchSpan span = this.matches.get(i);
      offsets[i * 2] = span.getStart();
      offsets[i * 2 + 1] = span.getEnd();
    }
    return offsets;
  }

  @Override
  public String toString() {
    return "SearchResult{found=" + isFound() + ", matches=" + this.matches + "}";
  }
}
