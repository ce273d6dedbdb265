/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.views.view;

import io.github.suppierk.java.Try;
import io.github.suppierk.views.jooq.DslContextProvider;
import io.github.suppierk.views.stream.ProjectionResult;
import io.github.suppierk.views.stream.ViewChangeBatch;
import io.github.suppierk.views.stream.ViewChangeStore;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the view groups of entities and runs their projection cycles:
 *
 * <ul>
 *   <li>On the init event - create the {@link EntityViewGroup}, bind its views and store their
 *       seeds via {@link ViewChangeStore}.
 *   <li>On any later event - invoke the projector registered for the event, drain every view once
 *       and append the drained changes via {@link ViewChangeStore}.
 * </ul>
 *
 * <p>Seeds and changes of one cycle are stored within a single transaction of the {@link
 * DSLContext} chosen by {@link DslContextProvider} for the event.
 *
 * <p>If a projector fails, changes it made so far are discarded together with the event and
 * nothing is stored. Any {@link Throwable} is rethrown as is, errors included.
 *
 * <p><b>Design note</b>: this class is not thread-safe. Events of an entity must be projected one
 * at a time, in the order the entity produced them.
 */
public final class EntityViewHost extends Suspicious {
  private static final Logger log = LoggerFactory.getLogger(EntityViewHost.class);

  private final DslContextProvider readWriteDslProvider;
  private final ViewChangeStore viewChangeStore;
  private final Map<Class<?>, RegisteredInit<?>> initializers;
  private final Map<EntityId, Session> sessions;

  /**
   * Default constructor.
   *
   * @param readWriteDslProvider to choose the transactional context for each event
   * @param viewChangeStore to persist seeds and drained changes with
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public EntityViewHost(
      final DslContextProvider readWriteDslProvider, final ViewChangeStore viewChangeStore) {
    this.readWriteDslProvider =
        throwIllegalArgumentIfNull(readWriteDslProvider, "Read-write DSL provider");
    this.viewChangeStore = throwIllegalArgumentIfNull(viewChangeStore, "View change store");
    this.initializers = new LinkedHashMap<>();
    this.sessions = new HashMap<>();
  }

  /**
   * Registers the way to create an {@link EntityViewGroup} from an init event.
   *
   * @param initEventClass this initializer is intended for
   * @param initializer creating the view group
   * @param <E> is the type of the init event
   * @return this host
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if an initializer for this event class is already registered
   */
  public <E extends DomainEvent<?, ?>> EntityViewHost addInit(
      final Class<E> initEventClass, final EntityViewGroupInit<E> initializer) {
    final Class<E> nonNullInitEventClass =
        throwIllegalArgumentIfNull(initEventClass, "Init event class");
    final EntityViewGroupInit<E> nonNullInitializer =
        throwIllegalArgumentIfNull(initializer, "View group initializer");

    if (initializers.containsKey(nonNullInitEventClass)) {
      throw new IllegalStateException(
          "View group initializer for '%s' is already registered"
              .formatted(nonNullInitEventClass.getSimpleName()));
    }

    initializers.put(
        nonNullInitEventClass, new RegisteredInit<>(nonNullInitEventClass, nonNullInitializer));
    return this;
  }

  /**
   * @return init event classes having a view group initializer
   */
  public Set<Class<?>> getSupportedInitEventClasses() {
    return Collections.unmodifiableSet(initializers.keySet());
  }

  /**
   * Creates the view group of a new entity and stores the seeds of its views.
   *
   * @param entityId identifier of the created entity
   * @param initEvent which created the entity
   * @return seeds of the views, together with changes made while the group was created
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if the entity already has a view group
   * @throws UnsupportedOperationException if there is no initializer for the event class
   */
  public ProjectionResult init(final EntityId entityId, final DomainEvent<?, ?> initEvent) {
    final EntityId nonNullEntityId = throwIllegalArgumentIfNull(entityId, "Entity id");
    final DomainEvent<?, ?> nonNullInitEvent = throwIllegalArgumentIfNull(initEvent, "Init event");

    if (sessions.containsKey(nonNullEntityId)) {
      throw new IllegalStateException(
          "Entity '%s' already has a view group".formatted(nonNullEntityId));
    }

    final RegisteredInit<?> initializer =
        throwUnsupportedOperationIfNull(
            initializers.get(nonNullInitEvent.getClass()),
            "View group initializer for '%s'"
                .formatted(nonNullInitEvent.getClass().getSimpleName()));

    final EntityViewGroup group =
        throwIllegalStateIfNull(initializer.apply(nonNullInitEvent), "View group");

    final ViewGroup views = new ViewGroup(nonNullEntityId);
    group.initViews(views);

    final ViewGroupProjectors projectors = new ViewGroupProjectors();
    group.initProjectors(projectors);

    final List<InitViewData> initValues = views.initValues();
    final List<ViewChangeBatch> changes = views.drain();

    if (!initValues.isEmpty() || !changes.isEmpty()) {
      store(nonNullInitEvent, initValues, changes);
    }

    sessions.put(nonNullEntityId, new Session(views, projectors));

    log.debug(
        "Created view group of entity '{}' with {} view(s) and {} projector(s)",
        nonNullEntityId,
        views.views().size(),
        projectors.getSupportedEventClasses().size());

    return new ProjectionResult(nonNullEntityId, initValues, changes);
  }

  /**
   * Runs one projection cycle for the event and stores the drained changes.
   *
   * @param entityId identifier of the entity which produced the event
   * @param event to project
   * @return changes drained from the views, empty if the event has no projector
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if the entity has no view group
   */
  public ProjectionResult project(final EntityId entityId, final DomainEvent<?, ?> event) {
    final EntityId nonNullEntityId = throwIllegalArgumentIfNull(entityId, "Entity id");
    final DomainEvent<?, ?> nonNullEvent = throwIllegalArgumentIfNull(event, "Event");

    final Session session = sessions.get(nonNullEntityId);
    if (session == null) {
      throw new IllegalStateException(
          "Entity '%s' has no view group, its init event must be projected first"
              .formatted(nonNullEntityId));
    }

    final Try<Boolean> projected = Try.of(() -> session.projectors().project(nonNullEvent));

    projected.ifSuccess(
        invoked -> {
          if (!invoked) {
            log.debug(
                "No projector for '{}' of entity '{}'",
                nonNullEvent.getClass().getSimpleName(),
                nonNullEntityId);
          }
        });

    projected.ifFailure(
        reason -> {
          final int dropped = session.views().discardChanges();
          log.warn(
              "Projection of '{}' for entity '{}' failed, {} pending change(s) discarded",
              nonNullEvent.getClass().getSimpleName(),
              nonNullEntityId,
              dropped,
              reason);
        });

    // Rethrows the projector's failure as is
    projected.get();

    final List<ViewChangeBatch> changes = session.views().drain();
    if (!changes.isEmpty()) {
      store(nonNullEvent, List.of(), changes);
    }

    log.debug(
        "Projected '{}' for entity '{}' into {} view change batch(es)",
        nonNullEvent.getClass().getSimpleName(),
        nonNullEntityId,
        changes.size());

    return new ProjectionResult(nonNullEntityId, List.of(), changes);
  }

  /**
   * @param entityId identifier of the entity
   * @return {@code true} if the entity has a view group
   */
  public boolean isInitialized(final EntityId entityId) {
    return sessions.containsKey(entityId);
  }

  /**
   * @param entityId identifier of the entity
   * @param viewName name of the view
   * @return view of the entity with the given name
   */
  public Optional<View<?>> findView(final EntityId entityId, final String viewName) {
    return Optional.ofNullable(sessions.get(entityId))
        .flatMap(session -> session.views().find(viewName));
  }

  /**
   * Forgets the view group of the entity, e.g. when the entity completes or is evicted.
   *
   * @param entityId identifier of the entity
   * @return {@code true} if the entity had a view group
   */
  public boolean close(final EntityId entityId) {
    return sessions.remove(entityId) != null;
  }

  private void store(
      final DomainEvent<?, ?> event,
      final List<InitViewData> initValues,
      final List<ViewChangeBatch> changes) {
    final DSLContext readWriteDsl =
        throwIllegalStateIfNull(readWriteDslProvider.apply(event), "Read-write DSL");

    readWriteDsl.transaction(
        (final Configuration trx) -> {
          if (!initValues.isEmpty()) {
            viewChangeStore.storeInitValues(trx.dsl(), initValues);
          }

          for (ViewChangeBatch batch : changes) {
            viewChangeStore.appendChanges(trx.dsl(), batch);
          }
        });
  }

  private record Session(ViewGroup views, ViewGroupProjectors projectors) {}

  /** Initializer together with the exact init event class it was registered for. */
  private record RegisteredInit<E extends DomainEvent<?, ?>>(
      Class<E> eventClass, EntityViewGroupInit<E> initializer) {
    EntityViewGroup apply(final DomainEvent<?, ?> initEvent) {
      return initializer.apply(eventClass.cast(initEvent));
    }
  }
}
