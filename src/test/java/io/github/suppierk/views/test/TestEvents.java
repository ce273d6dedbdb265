package io.github.suppierk.views.test;

import io.github.suppierk.views.view.DomainEvent;
import java.time.Instant;
import java.util.UUID;

/** Sample {@link DomainEvent}s for tests. */
public final class TestEvents {
  private TestEvents() {
    // No instance
  }

  /**
   * Creates an entity owning a {@link CounterViewGroup}.
   *
   * @param messageId to fulfill {@link DomainEvent#messageId()} contract
   * @param createdAt to fulfill {@link DomainEvent#createdAt()} contract
   * @param seed initial value of the counter
   */
  public record CounterCreated(UUID messageId, Instant createdAt, int seed)
      implements DomainEvent<UUID, Instant> {
    public CounterCreated(int seed) {
      this(UUID.randomUUID(), Instant.now(), seed);
    }
  }

  public record Incremented(UUID messageId, Instant createdAt, int by)
      implements DomainEvent<UUID, Instant> {
    public Incremented(int by) {
      this(UUID.randomUUID(), Instant.now(), by);
    }
  }

  public record Decremented(UUID messageId, Instant createdAt, int by)
      implements DomainEvent<UUID, Instant> {
    public Decremented(int by) {
      this(UUID.randomUUID(), Instant.now(), by);
    }
  }

  /** Increments the counter and then fails. */
  public record Exploded(UUID messageId, Instant createdAt) implements DomainEvent<UUID, Instant> {
    public Exploded() {
      this(UUID.randomUUID(), Instant.now());
    }
  }

  /** Increments the counter and then fails with an {@link AssertionError}. */
  public record Broken(UUID messageId, Instant createdAt) implements DomainEvent<UUID, Instant> {
    public Broken() {
      this(UUID.randomUUID(), Instant.now());
    }
  }

  public record Renamed(UUID messageId, Instant createdAt, String title)
      implements DomainEvent<UUID, Instant> {
    public Renamed(String title) {
      this(UUID.randomUUID(), Instant.now(), title);
    }
  }

  /** Has no projector in {@link CounterViewGroup}. */
  public record Ignored(UUID messageId, Instant createdAt) implements DomainEvent<UUID, Instant> {
    public Ignored() {
      this(UUID.randomUUID(), Instant.now());
    }
  }
}
