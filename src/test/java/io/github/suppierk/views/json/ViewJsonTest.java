package io.github.suppierk.views.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.change.CounterAttrIncremented;
import io.github.suppierk.views.change.CounterAttrReset;
import io.github.suppierk.views.change.CounterIncremented;
import io.github.suppierk.views.change.ListCleared;
import io.github.suppierk.views.change.ListItemChanged;
import io.github.suppierk.views.change.ListItemMoved;
import io.github.suppierk.views.change.RefChanged;
import io.github.suppierk.views.change.RefValueAttrChanged;
import io.github.suppierk.views.change.ValueChanged;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ViewJsonTest {
  static final EntityId ORDER = EntityId.of("order-1");
  static final EntityId ITEM = EntityId.of("item-1");

  @Nested
  class InitData {
    @Test
    void when_encoded_init_view_data_has_key_name_value_and_type() {
      final var json = new InitViewData(ORDER, "total", ViewValue.ofInt(10)).toJson();

      assertEquals("order-1", json.get("key").textValue());
      assertEquals("total", json.get("name").textValue());
      assertEquals(10, json.get("value").intValue());
      assertEquals("int", json.get("type").textValue());
    }

    @Test
    void when_timestamp_is_encoded_it_becomes_epoch_milliseconds() {
      final var createdAt = Instant.ofEpochMilli(1_700_000_000_123L);
      final var json =
          new InitViewData(ORDER, "createdAt", ViewValue.ofTimestamp(createdAt)).toJson();

      assertTrue(json.get("value").isIntegralNumber());
      assertEquals(1_700_000_000_123L, json.get("value").longValue());
      assertEquals("DateTime", json.get("type").textValue());
    }

    @Test
    void when_optional_string_is_empty_it_is_encoded_as_null() {
      final var json =
          new InitViewData(ORDER, "assignee", ViewValue.ofOptionalString(null)).toJson();

      assertTrue(json.get("value").isNull());
      assertEquals("String?", json.get("type").textValue());
    }

    @Test
    void when_decoded_init_view_data_equals_the_encoded_one() {
      final var items =
          new InitViewData(ORDER, "items", ViewValue.ofStringList(List.of("a", "b")));
      final var createdAt =
          new InitViewData(
              ORDER, "createdAt", ViewValue.ofTimestamp(Instant.ofEpochMilli(1_000L)));

      assertEquals(items, ViewJson.readInitViewData(ViewJson.write(items)));
      assertEquals(createdAt, ViewJson.readInitViewData(ViewJson.write(createdAt)));
    }

    @Test
    void when_value_does_not_match_its_type_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              ViewJson.readInitViewData(
                  "{\"key\":\"order-1\",\"name\":\"total\",\"value\":\"ten\",\"type\":\"int\"}"));
    }
  }

  @Nested
  class Changes {
    @Test
    void when_counter_change_is_encoded_it_has_type_and_payload() {
      final var json = new CounterIncremented(3).toJson();

      assertEquals("CounterIncremented", json.get("type").textValue());
      assertEquals(3, json.get("by").intValue());
    }

    @Test
    void when_value_change_is_encoded_it_carries_the_value_type() {
      final var json = new ValueChanged<>(ViewValue.ofString("paid")).toJson();

      assertEquals("ValueChanged", json.get("type").textValue());
      assertEquals("paid", json.get("newValue").textValue());
      assertEquals("String", json.get("valueType").textValue());
    }

    @Test
    void when_ref_is_cleared_new_value_is_encoded_as_null() {
      final var json = new RefChanged(null).toJson();

      assertEquals("RefChanged", json.get("type").textValue());
      assertTrue(json.get("newValue").isNull());
      assertNull(((RefChanged) ViewJson.readChange(json.toString())).newValue());
    }

    @Test
    void when_attribute_change_is_encoded_it_has_item_and_attribute_names() {
      final var json = new CounterAttrIncremented(ITEM, "score", 4).toJson();

      assertEquals("CounterAttrIncremented", json.get("type").textValue());
      assertEquals("item-1", json.get("attrId").textValue());
      assertEquals("score", json.get("attrName").textValue());
      assertEquals(4, json.get("by").intValue());
    }

    @Test
    void when_list_cleared_is_encoded_only_its_type_is_present() {
      final var json = new ListCleared().toJson();

      assertEquals(1, json.size());
      assertEquals("ListCleared", json.get("type").textValue());
    }

    @Test
    void when_decoded_change_equals_the_encoded_one() {
      final List<Change> changes =
          List.of(
              new ValueChanged<>(ViewValue.ofBoolean(true)),
              new ValueChanged<>(ViewValue.ofTimestamp(Instant.ofEpochMilli(5L))),
              new RefChanged(ITEM),
              new ListItemChanged(ITEM, EntityId.of("item-2")),
              new ListItemMoved(ITEM, 0),
              new ListCleared(),
              new CounterAttrReset(ITEM, "score", 0),
              new RefValueAttrChanged<>(ITEM, "label", ViewValue.ofOptionalString(null)));

      for (Change change : changes) {
        assertEquals(change, ViewJson.readChange(ViewJson.write(change)), change.toString());
      }
    }

    @Test
    void when_change_type_is_unknown_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> ViewJson.readChange("{\"type\":\"Exploded\"}"));
    }

    @Test
    void when_json_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> ViewJson.readChange(null));
    }
  }
}
