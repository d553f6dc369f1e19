package com.contextsmith.sensitive.dfa;

/**
 * The node pool could not obtain memory for the requested number of nodes.
 */
public class AllocationFailedException extends DfaBuildException {
  private static final long serialVersionUID = 1L;

  private final int requestedNodes;

  public AllocationFailedException(int requestedNodes, Throwable cause) {
    super(String.format("Could not allocate memory for %d nodes.",
                        requestedNodes), cause);
    this.requestedNodes = requestedNodes;
  }

  public int getRequestedNodes() {
    return this.requestedNodes;
  }
}
