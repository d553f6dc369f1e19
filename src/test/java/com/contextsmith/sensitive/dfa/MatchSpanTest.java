package com.contextsmith.sensitive.dfa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class MatchSpanTest {

  @Test
  public void endIsInclusive() {
    MatchSpan span = new MatchSpan(4, 6);
    assertEquals(3, span.length());
    assertTrue(span.getRange().contains(6));
    assertFalse(span.getRange().contains(7));
    assertEquals("[4, 6]", span.toString());
  }

  @Test
  public void valueSemantics() {
    assertEquals(new MatchSpan(1, 2), new MatchSpan(1, 2));
    assertEquals(new MatchSpan(1, 2).hashCode(), new MatchSpan(1, 2).hashCode());
    assertNotEquals(new MatchSpan(1, 2), new MatchSpan(1, 3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsEndBeforeStart() {
    new MatchSpan(3, 2);
  }
}
