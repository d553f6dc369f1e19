package com.contextsmith.sensitive.dfa;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.Arrays;

/**
 * Flat pool of trie nodes addressed by index. Node 0 is the root.
 *
 * <p>Every node owns {@link #CHARSET_SIZE} consecutive slots of the
 * transition table, holding either a child index or {@link #ABSENT}, and
 * {@link #MASK_WORDS} longs of the end marker table, one bit per byte value.
 * Nodes are only ever appended; the whole pool is dropped at once by
 * {@link #release()}.</p>
 *
 * <p>Storage grows geometrically up to the configured capacity rather than
 * being reserved up front. Not thread-safe while nodes are being added.</p>
 */
final class NodeArena {

  // The next byte can take at most 255 values (0-254).
  static final int CHARSET_SIZE = 255;
  static final int ABSENT = -1;
  static final int ROOT = 0;

  // 4 x 64 bits covers every byte value.
  static final int MASK_WORDS = 4;

  // Largest capacity whose transition table still fits in a single array.
  static final int MAX_CAPACITY = (Integer.MAX_VALUE - 8) / CHARSET_SIZE;

  static final int INITIAL_NODES = 1024;

  static boolean isEnd(long[] endMasks, int node, int c) {
    return (endMasks[node * MASK_WORDS + (c >>> 6)] & (1L << (c & 63))) != 0;
  }

  static NodeArena create(int capacity) throws AllocationFailedException {
    checkArgument(capacity >= 1 && capacity <= MAX_CAPACITY,
                  "Capacity should be within %s and %s, got %s.",
                  1, MAX_CAPACITY, capacity);
    NodeArena arena = new NodeArena(capacity);
    arena.grow();
    arena.initNode();  // Root.
    return arena;
  }

  private final int capacity;
  private int[] next;
  private long[] endMasks;
  private int size;
  private volatile boolean released;

  private NodeArena(int capacity) {
    this.capacity = capacity;
    this.next = new int[0];
    this.endMasks = new long[0];
    this.size = 0;
    this.released = false;
  }

  /**
   * Appends a fresh node with no transitions and no end markers.
   *
   * @throws CapacityExceededException if the pool already holds
   *     {@code capacity} nodes; nothing is written in that case
   */
  int allocateNode()
      throws CapacityExceededException, AllocationFailedException {
    checkLive();
    if (this.size >= this.capacity) {
      throw new CapacityExceededException(this.capacity);
    }
    if (this.size == allocatedNodes()) grow();
    return initNode();
  }

  int capacity() {
    return this.capacity;
  }

  int endMarkerCount() {
    checkLive();
    int count = 0;
    for (int i = 0; i < this.size * MASK_WORDS; ++i) {
      count += Long.bitCount(this.endMasks[i]);
    }
    return count;
  }

  long[] endMasks() {
    checkLive();
    return this.endMasks;
  }

  int getNext(int node, int c) {
    checkLive();
    return this.next[slot(node, c)];
  }

  boolean isEnd(int node, int c) {
    checkLive();
    checkNode(node);
    return isEnd(this.endMasks, node, c);
  }

  boolean isReleased() {
    return this.released;
  }

  void markEnd(int node, int c) {
    checkLive();
    checkNode(node);
    checkByte(c);
    this.endMasks[node * MASK_WORDS + (c >>> 6)] |= 1L << (c & 63);
  }

  /** Drops all node memory. Calling it again has no effect. */
  void release() {
    this.released = true;
    this.next = null;
    this.endMasks = null;
  }

  void setNext(int node, int c, int child) {
    checkLive();
    checkArgument(child == ABSENT || (child >= 0 && child < this.size),
                  "Invalid child index: %s", child);
    this.next[slot(node, c)] = child;
  }

  int size() {
    return this.size;
  }

  int[] transitions() {
    checkLive();
    return this.next;
  }

  private int allocatedNodes() {
    return this.next.length / CHARSET_SIZE;
  }

  private void checkByte(int c) {
    checkArgument(c >= 0 && c < CHARSET_SIZE, "Byte out of alphabet: %s", c);
  }

  private void checkLive() {
    checkState(!this.released, "Automaton has already been released.");
  }

  private void checkNode(int node) {
    checkArgument(node >= 0 && node < this.size, "Invalid node index: %s", node);
  }

  private void grow() throws AllocationFailedException {
    int nodes = Math.min(this.capacity,
                         Math.max(INITIAL_NODES, allocatedNodes() * 2));
    try {
      this.next = Arrays.copyOf(this.next, nodes * CHARSET_SIZE);
      this.endMasks = Arrays.copyOf(this.endMasks, nodes * MASK_WORDS);
    } catch (OutOfMemoryError e) {
      throw new AllocationFailedException(nodes, e);
    }
  }

  private int initNode() {
    int node = this.size++;
    Arrays.fill(this.next, node * CHARSET_SIZE, (node + 1) * CHARSET_SIZE,
                ABSENT);
    Arrays.fill(this.endMasks, node * MASK_WORDS, (node + 1) * MASK_WORDS, 0L);
    return node;
  }

  private int slot(int node, int c) {
    checkNode(node);
    checkByte(c);
    return node * CHARSET_SIZE + c;
  }
}
