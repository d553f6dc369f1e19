package com.contextsmith.sensitive.dfa;

public class CapacityExceededException extends DfaBuildException {
  private static final long serialVersionUID = 1L;

  private final int capacity;

  public CapacityExceededException(int capacity) {
    super(String.format(
        "Word list needs more than %d nodes, increase the node capacity.",
        capacity));
    this.capacity = capacity;
  }

  public int getCapacity() {
    return this.capacity;
  }
}
