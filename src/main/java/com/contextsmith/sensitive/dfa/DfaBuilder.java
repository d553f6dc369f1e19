package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

/**
 * Inserts words into a fresh {@link NodeArena} one byte at a time and hands
 * out the finished {@link Dfa}.
 *
 * <p>A builder is single-use: after {@link #build()} or {@link #abandon()} no
 * more words can be added.</p>
 */
public class DfaBuilder {
  private static final Logger log = LoggerFactory.getLogger(DfaBuilder.class);

  // Roughly 3GB of transition tables when full.
  public static final int DEFAULT_CAPACITY = 3000000;

  // Shorter words are not considered sensitive.
  public static final int MIN_WORD_BYTES = 2;

  /**
   * Builds an automaton from {@code words}, inserted in iteration order. If
   * any insertion fails the partial automaton is released before the
   * exception propagates.
   */
  public static Dfa build(Iterable<byte[]> words, int capacity)
      throws DfaBuildException {
    checkNotNull(words);
    Stopwatch stopwatch = Stopwatch.createStarted();
    DfaBuilder builder = new DfaBuilder(capacity);
    try {
      for (byte[] word : words) {
        builder.add(word);
      }
    } catch (DfaBuildException e) {
      builder.abandon();
      log.error("Failed to build automaton after {} words: {}",
                builder.getWordCount(), e.getMessage());
      throw e;
    }
    Dfa dfa = builder.build();
    log.info("Built automaton of {} words ({} skipped, {} nodes) in {}",
             builder.getWordCount(), builder.getSkippedCount(),
             dfa.getNodeCount(), stopwatch);
    return dfa;
  }

  /**
   * Same as {@link #build(Iterable, int)} with every word encoded as UTF-8.
   */
  public static Dfa buildFromStrings(Iterable<String> words, int capacity)
      throws DfaBuildException {
    checkNotNull(words);
    List<byte[]> encoded = new ArrayList<>();
    for (String word : words) {
      checkNotNull(word, "Word list cannot contain null");
      encoded.add(word.getBytes(StandardCharsets.UTF_8));
    }
    return build(encoded, capacity);
  }

  private final NodeArena arena;
  private boolean isBuilt;
  private int wordCount;
  private int skippedCount;

  public DfaBuilder(int capacity) throws AllocationFailedException {
    this.arena = NodeArena.create(capacity);
    this.isBuilt = false;
  }

  /**
   * Releases the nodes allocated so far. The builder cannot be used again.
   * Has no effect once {@link #build()} has handed out the automaton.
   */
  public void abandon() {
    if (this.isBuilt) return;
    this.isBuilt = true;
    this.arena.release();
  }

  /**
   * Adds a word to the trie. Words shorter than {@link #MIN_WORD_BYTES} and
   * words containing the byte 0xFF (outside the 255-symbol alphabet) are
   * skipped.
   *
   * <p>The end marker of a word is kept on the node reached before its last
   * byte, keyed by that byte.</p>
   *
   * @return true if the word was inserted
   * @throws CapacityExceededException if a new node would exceed capacity;
   *     the builder must then be abandoned
   */
  public boolean add(byte[] word)
      throws CapacityExceededException, AllocationFailedException {
    checkState(!this.isBuilt, "Can't add words after build() is called.");
    checkNotNull(word);

    if (word.length < MIN_WORD_BYTES) {
      log.trace("Skipping word shorter than {} bytes", MIN_WORD_BYTES);
      ++this.skippedCount;
      return false;
    }
    for (byte b : word) {
      if ((b & 0xFF) >= NodeArena.CHARSET_SIZE) {
        log.warn("Skipping word containing byte 0xFF");
        ++this.skippedCount;
        return false;
      }
    }

    int state = NodeArena.ROOT;
    for (int i = 0; i < word.length; ++i) {
      int c = word[i] & 0xFF;
      int child = this.arena.getNext(state, c);
      if (child == NodeArena.ABSENT) {
        child = this.arena.allocateNode();
        this.arena.setNext(state, c, child);
      }
      if (i == word.length - 1) {
        this.arena.markEnd(state, c);
      }
      state = child;
    }
    ++this.wordCount;
    return true;
  }

  /**
   * Freezes the builder and returns the automaton.
   */
  public Dfa build() {
    checkState(!this.isBuilt, "build() has already been called.");
    this.isBuilt = true;
    return new Dfa(this.arena);
  }

  public int getNodeCount() {
    return this.arena.size();
  }

  public int getSkippedCount() {
    return this.skippedCount;
  }

  public int getWordCount() {
    return this.wordCount;
  }
}
