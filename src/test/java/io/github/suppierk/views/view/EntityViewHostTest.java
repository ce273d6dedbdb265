package io.github.suppierk.views.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.views.change.CounterDecremented;
import io.github.suppierk.views.change.CounterIncremented;
import io.github.suppierk.views.change.ValueChanged;
import io.github.suppierk.views.jooq.DslContextProvider;
import io.github.suppierk.views.stream.ViewChangeBatch;
import io.github.suppierk.views.stream.ViewChangeStore;
import io.github.suppierk.views.test.CounterViewGroup;
import io.github.suppierk.views.test.RecordingViewChangeStore;
import io.github.suppierk.views.test.TestDatabase;
import io.github.suppierk.views.test.TestEvents.Broken;
import io.github.suppierk.views.test.TestEvents.CounterCreated;
import io.github.suppierk.views.test.TestEvents.Decremented;
import io.github.suppierk.views.test.TestEvents.Exploded;
import io.github.suppierk.views.test.TestEvents.Ignored;
import io.github.suppierk.views.test.TestEvents.Incremented;
import io.github.suppierk.views.test.TestEvents.Renamed;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import java.util.List;
import java.util.Set;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EntityViewHostTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.create("entity_view_host_test");
  static final EntityId ORDER = EntityId.of("order-1");

  RecordingViewChangeStore store;
  EntityViewHost host;

  @BeforeEach
  void setUp() {
    store = new RecordingViewChangeStore();
    host =
        new EntityViewHost(DslContextProvider.dslContextIdentity(DSL_CONTEXT), store)
            .addInit(CounterCreated.class, CounterViewGroup::new);
  }

  @Nested
  class Registration {
    @Test
    void when_constructor_arguments_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> new EntityViewHost(null, ViewChangeStore.empty()));
      assertThrows(
          IllegalArgumentException.class,
          () -> new EntityViewHost(DslContextProvider.dslContextIdentity(DSL_CONTEXT), null));
    }

    @Test
    void when_initializer_is_registered_twice_illegal_state_exception_is_thrown() {
      assertThrows(
          IllegalStateException.class,
          () -> host.addInit(CounterCreated.class, CounterViewGroup::new));
      assertEquals(Set.of(CounterCreated.class), host.getSupportedInitEventClasses());
    }

    @Test
    void when_initializer_arguments_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> host.addInit(null, event -> NoViewGroup.getInstance()));
      assertThrows(IllegalArgumentException.class, () -> host.addInit(Renamed.class, null));
    }
  }

  @Nested
  class Init {
    @Test
    void when_entity_is_created_seeds_of_every_view_are_stored() {
      final var result = host.init(ORDER, new CounterCreated(10));

      final var expected =
          List.of(
              new InitViewData(ORDER, CounterViewGroup.COUNTER, ViewValue.ofInt(10)),
              new InitViewData(ORDER, CounterViewGroup.TITLE, ViewValue.ofString("untitled")));

      assertEquals(ORDER, result.entityId());
      assertEquals(expected, result.initValues());
      assertTrue(result.changes().isEmpty());
      assertEquals(expected, store.storedInitValues);
      assertTrue(host.isInitialized(ORDER));
    }

    @Test
    void when_entity_is_created_twice_illegal_state_exception_is_thrown() {
      host.init(ORDER, new CounterCreated(10));
      store.clear();

      assertThrows(IllegalStateException.class, () -> host.init(ORDER, new CounterCreated(1)));
      assertTrue(store.storedInitValues.isEmpty());
    }

    @Test
    void when_init_event_has_no_initializer_unsupported_operation_exception_is_thrown() {
      assertThrows(UnsupportedOperationException.class, () -> host.init(ORDER, new Renamed("x")));
      assertFalse(host.isInitialized(ORDER));
    }

    @Test
    void when_initializer_returns_null_illegal_state_exception_is_thrown() {
      host.addInit(Ignored.class, event -> null);

      assertThrows(IllegalStateException.class, () -> host.init(ORDER, new Ignored()));
      assertFalse(host.isInitialized(ORDER));
    }

    @Test
    void when_entity_has_no_views_nothing_is_stored() {
      host.addInit(Ignored.class, event -> NoViewGroup.getInstance());

      final var result = host.init(ORDER, new Ignored());

      assertTrue(result.initValues().isEmpty());
      assertTrue(store.storedInitValues.isEmpty());
      assertTrue(host.isInitialized(ORDER));
    }

    @Test
    void when_arguments_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> host.init(null, new CounterCreated(1)));
      assertThrows(IllegalArgumentException.class, () -> host.init(ORDER, null));
    }
  }

  @Nested
  class Project {
    @BeforeEach
    void setUp() {
      host.init(ORDER, new CounterCreated(10));
      store.clear();
    }

    @Test
    void when_counter_events_are_projected_every_change_is_stored_in_order() {
      final var first = host.project(ORDER, new Incremented(3));
      final var second = host.project(ORDER, new Decremented(1));

      assertEquals(List.of(new CounterIncremented(3)), first.changesOf(CounterViewGroup.COUNTER));
      assertEquals(List.of(new CounterDecremented(1)), second.changesOf(CounterViewGroup.COUNTER));
      assertEquals(
          List.of(
              new ViewChangeBatch(
                  ORDER, CounterViewGroup.COUNTER, List.of(new CounterIncremented(3))),
              new ViewChangeBatch(
                  ORDER, CounterViewGroup.COUNTER, List.of(new CounterDecremented(1)))),
          store.appendedBatches);

      final var counter =
          (CounterView) host.findView(ORDER, CounterViewGroup.COUNTER).orElseThrow();
      assertEquals(10, counter.defaultValue());
    }

    @Test
    void when_event_touches_one_view_only_its_batch_is_produced() {
      final var result = host.project(ORDER, new Renamed("Groceries"));

      assertEquals(1, result.changes().size());
      assertEquals(
          List.of(new ValueChanged<>(ViewValue.ofString("Groceries"))),
          result.changesOf(CounterViewGroup.TITLE));
      assertTrue(result.changesOf(CounterViewGroup.COUNTER).isEmpty());
      assertTrue(result.findBatch(CounterViewGroup.COUNTER).isEmpty());
    }

    @Test
    void when_event_has_no_projector_nothing_is_stored() {
      final var result = host.project(ORDER, new Ignored());

      assertTrue(result.changes().isEmpty());
      assertTrue(store.appendedBatches.isEmpty());
    }

    @Test
    void when_projector_fails_exception_is_rethrown_and_nothing_is_stored() {
      final var failure =
          assertThrows(IllegalStateException.class, () -> host.project(ORDER, new Exploded()));
      assertEquals("Projector failure", failure.getMessage());
      assertTrue(store.appendedBatches.isEmpty());

      final var next = host.project(ORDER, new Incremented(1));
      assertEquals(List.of(new CounterIncremented(1)), next.changesOf(CounterViewGroup.COUNTER));
    }

    @Test
    void when_projector_throws_an_error_it_is_rethrown_and_pending_changes_are_discarded() {
      final var failure =
          assertThrows(AssertionError.class, () -> host.project(ORDER, new Broken()));
      assertEquals("Counter overflow", failure.getMessage());
      assertTrue(store.appendedBatches.isEmpty());

      final var next = host.project(ORDER, new Incremented(1));
      assertEquals(List.of(new CounterIncremented(1)), next.changesOf(CounterViewGroup.COUNTER));
      assertEquals(
          List.of(
              new ViewChangeBatch(
                  ORDER, CounterViewGroup.COUNTER, List.of(new CounterIncremented(1)))),
          store.appendedBatches);
    }

    @Test
    void when_entity_is_unknown_illegal_state_exception_is_thrown() {
      assertThrows(
          IllegalStateException.class,
          () -> host.project(EntityId.of("order-2"), new Incremented(1)));
    }

    @Test
    void when_entity_is_closed_it_has_to_be_created_again() {
      assertNotNull(host.findView(ORDER, CounterViewGroup.TITLE).orElse(null));
      assertTrue(host.close(ORDER));
      assertFalse(host.close(ORDER));

      assertFalse(host.isInitialized(ORDER));
      assertTrue(host.findView(ORDER, CounterViewGroup.TITLE).isEmpty());
      assertThrows(IllegalStateException.class, () -> host.project(ORDER, new Incremented(1)));
    }
  }

  @Test
  void when_views_are_found_they_are_the_group_views() {
    final var group = new CounterViewGroup(new CounterCreated(5));
    host.addInit(Ignored.class, event -> group);
    host.init(ORDER, new Ignored());

    assertSame(group.counter(), host.findView(ORDER, CounterViewGroup.COUNTER).orElseThrow());
  }
}
