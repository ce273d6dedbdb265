package io.github.suppierk.views.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EntityIdTest {
  @Test
  void when_value_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new EntityId(null));
    assertThrows(IllegalArgumentException.class, () -> EntityId.of(null));
  }

  @Test
  void when_values_are_equal_entity_ids_are_equal() {
    assertEquals(new EntityId("order-1"), EntityId.of("order-1"));
    assertEquals(new EntityId("order-1").hashCode(), EntityId.of("order-1").hashCode());
  }

  @Test
  void when_printed_entity_id_is_its_value() {
    assertEquals("order-1", EntityId.of("order-1").toString());
  }

  @Test
  void when_compared_entity_ids_follow_their_values() {
    assertTrue(EntityId.of("a").compareTo(EntityId.of("b")) < 0);
    assertEquals(0, EntityId.of("a").compareTo(EntityId.of("a")));
  }
}
