package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Range;

/**
 * One word occurrence. Both offsets are inclusive byte indices into the
 * scanned text.
 */
public final class MatchSpan {

  private final int start;
  private final int end;

  public MatchSpan(int start, int end) {
    checkArgument(start >= 0 && end >= start,
                  "Invalid span [%s, %s]", start, end);
    this.start = start;
    this.end = end;
  }

  public int getEnd() {
    return this.end;
  }

  public Range<Integer> getRange() {
    return Range.closed(this.start, this.end);
  }

  public int getStart() {
    return this.start;
  }

  public int length() {
    return this.end - this.start + 1;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) return true;
    if (!(other instanceof MatchSpan)) return false;
    MatchSpan span = (MatchSpan) other;
    return this.start == span.start && this.end == span.end;
  }

  @Override
  public int hashCode() {
    return 31 * this.start + this.end;
  }

  @Override
  public String toString() {
    return "[" + this.start + ", " + this.end + "]";
  }
}
