package io.txevents.dispatch;

import io.txevents.registry.HandlerRegistry;
import io.txevents.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable factory of {@link TransactionalEventDispatcher} instances sharing one
 * configuration.
 *
 * <p>This is the object command handlers receive at wiring time. They call
 * {@link #newDispatcher()} inside the transactional work, so every attempt of a retried
 * transaction starts with an empty queue.
 *
 * <pre>{@code
 * txScope.execute(ctx, txCtx -> {
 *   TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
 *   ...
 *   dispatcher.flush(txCtx);
 * });
 * }</pre>
 */
public final class TransactionalEventDispatchers {
  private final HandlerRegistry handlerRegistry;
  private final int maxDepth;
  private final List<DispatchInterceptor> interceptors;
  private final MetricsExporter metrics;

  private TransactionalEventDispatchers(Builder builder) {
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    if (builder.maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1, got: " + builder.maxDepth);
    }
    this.maxDepth = builder.maxDepth;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a new dispatcher with an empty queue.
   */
  public TransactionalEventDispatcher newDispatcher() {
    return TransactionalEventDispatcher.builder()
        .handlerRegistry(handlerRegistry)
        .maxDepth(maxDepth)
        .interceptors(interceptors)
        .metrics(metrics)
        .build();
  }

  public HandlerRegistry handlerRegistry() {
    return handlerRegistry;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /** Builder for {@link TransactionalEventDispatchers}. */
  public static final class Builder {
    private HandlerRegistry handlerRegistry;
    private int maxDepth = TransactionalEventDispatcher.DEFAULT_MAX_DEPTH;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();
    private MetricsExporter metrics;

    private Builder() {}

    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    public Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public TransactionalEventDispatchers build() {
      return new TransactionalEventDispatchers(this);
    }
  }
}
