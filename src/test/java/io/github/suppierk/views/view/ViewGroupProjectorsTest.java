package io.github.suppierk.views.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.views.test.TestEvents.Decremented;
import io.github.suppierk.views.test.TestEvents.Ignored;
import io.github.suppierk.views.test.TestEvents.Incremented;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ViewGroupProjectorsTest {
  @Test
  void when_arguments_are_null_illegal_argument_exception_is_thrown() {
    final var projectors = new ViewGroupProjectors();

    assertThrows(IllegalArgumentException.class, () -> projectors.add(null, event -> {}));
    assertThrows(IllegalArgumentException.class, () -> projectors.add(Incremented.class, null));
    assertThrows(IllegalArgumentException.class, () -> projectors.project(null));
  }

  @Test
  void when_projector_is_registered_twice_illegal_state_exception_is_thrown() {
    final var projectors = new ViewGroupProjectors();
    projectors.add(Incremented.class, event -> {});

    assertThrows(
        IllegalStateException.class, () -> projectors.add(Incremented.class, event -> {}));
  }

  @Test
  void when_event_has_a_projector_it_is_invoked() {
    final var projectors = new ViewGroupProjectors();
    final var total = new AtomicInteger();
    projectors.add(Incremented.class, event -> total.addAndGet(event.by()));

    assertTrue(projectors.project(new Incremented(3)));
    assertEquals(3, total.get());
    assertEquals(Set.of(Incremented.class), projectors.getSupportedEventClasses());
  }

  @Test
  void when_several_projectors_are_registered_each_receives_its_own_event_class() {
    final var projectors = new ViewGroupProjectors();
    final List<Incremented> increments = new ArrayList<>();
    final List<Decremented> decrements = new ArrayList<>();
    projectors.add(Incremented.class, increments::add);
    projectors.add(Decremented.class, decrements::add);

    final var increment = new Incremented(2);
    final var decrement = new Decremented(1);

    assertTrue(projectors.project(decrement));
    assertTrue(projectors.project(increment));
    assertEquals(1, increments.size());
    assertSame(increment, increments.get(0));
    assertEquals(1, decrements.size());
    assertSame(decrement, decrements.get(0));
  }

  @Test
  void when_event_has_no_projector_nothing_happens() {
    assertFalse(new ViewGroupProjectors().project(new Ignored()));
  }
}
