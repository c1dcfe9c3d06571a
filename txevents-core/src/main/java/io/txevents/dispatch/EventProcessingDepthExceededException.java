package io.txevents.dispatch;

/**
 * Thrown when one flush would process more events than the dispatcher's depth limit, which
 * usually means handlers publish events to each other in a cycle.
 */
public final class EventProcessingDepthExceededException extends EventDispatchException {
  private final int maxDepth;

  public EventProcessingDepthExceededException(int maxDepth) {
    super("Event processing depth exceeded: more than " + maxDepth + " events in one flush");
    this.maxDepth = maxDepth;
  }

  public int maxDepth() {
    return maxDepth;
  }
}
