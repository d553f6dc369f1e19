package com.contextsmith.sensitive;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.sensitive.dfa.Dfa;
import com.contextsmith.sensitive.dfa.DfaBuildException;
import com.contextsmith.sensitive.dfa.DfaBuilder;
import com.contextsmith.sensitive.dfa.MatchSpan;
import com.contextsmith.sensitive.dfa.SearchResult;
import com.contextsmith.sensitive.dfa.Searcher;

/**
 * Checks strings against a sensitive word list. The word list can be replaced
 * as a whole with {@link #update(Collection)} while other threads keep
 * checking; a check always runs against one complete vocabulary.
 */
public class SensitiveWordSearch implements AutoCloseable {
  private static final Logger log =
      LoggerFactory.getLogger(SensitiveWordSearch.class);

  public static SensitiveWordSearch create(Collection<String> words)
      throws DfaBuildException {
    return create(words, DfaBuilder.DEFAULT_CAPACITY);
  }

  public static SensitiveWordSearch create(Collection<String> words,
                                           int capacity)
      throws DfaBuildException {
    checkNotNull(words);
    return new SensitiveWordSearch(DfaBuilder.buildFromStrings(words, capacity),
                                   capacity);
  }

  public static SensitiveWordSearch create(SearchConfig config,
                                           Collection<String> words)
      throws DfaBuildException {
    checkNotNull(config);
    return create(words, config.getCapacity());
  }

  private final int capacity;
  // Guards the dfa reference against being released mid-scan.
  private final ReentrantReadWriteLock swapLock = new ReentrantReadWriteLock();
  // Only one rebuild at a time; others are skipped.
  private final ReentrantLock updateLock = new ReentrantLock();
  private Dfa dfa;

  private SensitiveWordSearch(Dfa dfa, int capacity) {
    this.dfa = dfa;
    this.capacity = capacity;
  }

  public SearchResult check(String text, int maxMatches) {
    checkNotNull(text);
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    this.swapLock.readLock().lock();
    try {
      checkState(this.dfa != null, "Search has been closed.");
      return Searcher.search(this.dfa, bytes, maxMatches);
    } finally {
      this.swapLock.readLock().unlock();
    }
  }

  /**
   * Returns the matched byte offsets flattened into
   * {@code [start0, end0, start1, end1, ...]}, ends inclusive.
   */
  public int[] checkSensitive(String text, int maxMatches) {
    return check(text, maxMatches).toOffsetArray();
  }

  @Override
  public void close() {
    this.swapLock.writeLock().lock();
    try {
      if (this.dfa != null) {
        this.dfa.close();
        this.dfa = null;
      }
    } finally {
      this.swapLock.writeLock().unlock();
    }
  }

  /**
   * Renders each match of {@code result} as
   * {@code "<word>: <start> -> <endExclusive>"}. {@code text} must be the
   * string that was checked.
   */
  public List<String> describe(String text, SearchResult result) {
    checkNotNull(text);
    checkNotNull(result);
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    List<String> lines = new ArrayList<>();
    for (MatchSpan span : result.getMatches()) {
      String word = new String(bytes, span.getStart(), span.length(),
                               StandardCharsets.UTF_8);
      String line = String.format("%s: %d -> %d", word, span.getStart(),
                                  span.getEnd() + 1);
      log.debug("Found sensitive word {}", line);
      lines.add(line);
    }
    return lines;
  }

  public int getCapacity() {
    return this.capacity;
  }

  public int getNodeCount() {
    this.swapLock.readLock().lock();
    try {
      checkState(this.dfa != null, "Search has been closed.");
      return this.dfa.getNodeCount();
    } finally {
      this.swapLock.readLock().unlock();
    }
  }

  public boolean isClosed() {
    this.swapLock.readLock().lock();
    try {
      return this.dfa == null;
    } finally {
      this.swapLock.readLock().unlock();
    }
  }

  /**
   * Replaces the whole word list. Returns false without doing anything if
   * another update is already running. If the new list fails to build, the
   * current one stays in use and the exception propagates.
   */
  public boolean update(Collection<String> words) throws DfaBuildException {
    checkNotNull(words);
    if (!this.updateLock.tryLock()) {
      log.info("Word list update already in progress, skipping");
      return false;
    }
    try {
      checkState(!isClosed(), "Search has been closed.");
      Dfa fresh = DfaBuilder.buildFromStrings(words, this.capacity);

      Dfa old;
      this.swapLock.writeLock().lock();
      try {
        old = this.dfa;
        if (old == null) {
          // Closed while building.
          fresh.close();
          throw new IllegalStateException("Search has been closed.");
        }
        this.dfa = fresh;
      } finally {
        this.swapLock.writeLock().unlock();
      }
      // No reader can still hold the old one past the write lock.
      old.close();
      log.info("Word list updated to {} words", words.size());
      return true;
    } finally {
      this.updateLock.unlock();
    }
  }
}
