package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A built, read-only byte trie. Instances are produced by {@link DfaBuilder}
 * and may be searched from any number of threads at once.
 *
 * <p>{@link #close()} releases the node pool. Searching a closed automaton
 * throws {@link IllegalStateException}.</p>
 *
 * <p>
 * Example usage:
 * <code><pre>
 *     Dfa dfa = DfaBuilder.buildFromStrings(
 *         Arrays.asList("bad", "eval", "你好"), DfaBuilder.DEFAULT_CAPACITY);
 *     SearchResult result = dfa.search(
 *         "This is a example, 你好.".getBytes(StandardCharsets.UTF_8), 20);
 *     for (MatchSpan span : result.getMatches()) {
 *         System.out.println("Found at: " + span);
 *     }
 *     dfa.close();
 * </pre></code>
 * </p>
 */
public final class Dfa implements AutoCloseable {
  private final NodeArena arena;

  Dfa(NodeArena arena) {
    this.arena = arena;
  }

  @Override
  public void close() {
    this.arena.release();
  }

  public int getCapacity() {
    return this.arena.capacity();
  }

  /**
   * Returns the number of (node, byte) pairs at which a word ends.
   */
  public int getEndMarkerCount() {
    return this.arena.endMarkerCount();
  }

  public int getNodeCount() {
    return this.arena.size();
  }

  /**
   * Returns true if input bytes is a prefix of one of the words in the tree.
   */
  public boolean hasPrefix(byte[] bytes) {
    checkNotNull(bytes);
    int state = NodeArena.ROOT;
    for (byte b : bytes) {
      int c = b & 0xFF;
      if (c >= NodeArena.CHARSET_SIZE) return false;
      state = this.arena.getNext(state, c);
      if (state == NodeArena.ABSENT) return false;
    }
    return true;
  }

  public boolean isClosed() {
    return this.arena.isReleased();
  }

  public SearchResult search(byte[] text, int maxMatches) {
    return Searcher.search(this, text, maxMatches);
  }

  NodeArena getArena() {
    return this.arena;
  }
}
