package io.github.suppierk.views.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.views.change.CounterDecremented;
import io.github.suppierk.views.change.CounterIncremented;
import io.github.suppierk.views.change.CounterReset;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import java.util.List;
import org.junit.jupiter.api.Test;

class CounterViewTest {
  static final EntityId ORDER = EntityId.of("order-1");

  @Test
  void when_counter_has_no_initial_value_it_starts_at_zero() {
    assertEquals(0, new CounterView("items").defaultValue());
  }

  @Test
  void when_view_is_not_bound_mutation_fails() {
    final var counter = new CounterView("items", 10);

    assertThrows(IllegalStateException.class, () -> counter.increment(1));
    assertThrows(IllegalStateException.class, () -> counter.decrement(1));
    assertThrows(IllegalStateException.class, () -> counter.reset(0));
  }

  @Test
  void when_bound_init_value_is_the_seed() {
    final var counter = new ViewGroup(ORDER).add(new CounterView("items", 10));

    assertEquals(
        List.of(new InitViewData(ORDER, "items", ViewValue.ofInt(10))), counter.initValues());
  }

  @Test
  void when_counter_changes_every_change_is_drained_in_order() {
    final var counter = new ViewGroup(ORDER).add(new CounterView("items", 10));

    counter.increment(3);
    counter.decrement(1);
    counter.reset(7);
    counter.increment(3);

    assertEquals(
        List.of(
            new CounterIncremented(3),
            new CounterDecremented(1),
            new CounterReset(7),
            new CounterIncremented(3)),
        counter.changes());
    assertTrue(counter.changes().isEmpty());
    assertEquals(10, counter.defaultValue());
  }

  @Test
  void when_increment_decrement_and_reset_are_called_drain_keeps_that_order() {
    final var counter = new ViewGroup(ORDER).add(new CounterView("items"));

    counter.increment(2);
    counter.decrement(1);
    counter.reset(5);

    assertEquals(
        List.of(new CounterIncremented(2), new CounterDecremented(1), new CounterReset(5)),
        counter.changes());
    assertTrue(counter.changes().isEmpty());
  }

  @Test
  void when_drained_list_is_modified_unsupported_operation_exception_is_thrown() {
    final var counter = new ViewGroup(ORDER).add(new CounterView("items"));
    counter.increment(1);

    final var changes = counter.changes();

    assertThrows(UnsupportedOperationException.class, () -> changes.add(new CounterReset(0)));
  }
}
