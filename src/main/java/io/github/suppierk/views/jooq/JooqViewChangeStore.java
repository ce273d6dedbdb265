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

package io.github.suppierk.views.jooq;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.json.ViewJson;
import io.github.suppierk.views.stream.ViewChangeBatch;
import io.github.suppierk.views.stream.ViewChangeStore;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ViewChangeStore} keeping seeds and change streams in two tables, see the {@code
 * view_store.sql} resource for their definition.
 *
 * <p>Every change is stored as its own row holding the JSON produced by {@link ViewJson}, so rows
 * of one view read back in insertion order form its change stream.
 */
public final class JooqViewChangeStore implements ViewChangeStore {
  /** Classpath resource with the DDL of the default tables. */
  public static final String SCHEMA_RESOURCE = "view_store.sql";

  public static final String DEFAULT_INIT_DATA_TABLE = "view_init_data";
  public static final String DEFAULT_CHANGES_TABLE = "view_changes";

  private static final Logger log = LoggerFactory.getLogger(JooqViewChangeStore.class);

  private static final Field<Long> ID = field(name("id"), SQLDataType.BIGINT);
  private static final Field<String> ENTITY_ID = field(name("entity_id"), SQLDataType.VARCHAR);
  private static final Field<String> VIEW_NAME = field(name("view_name"), SQLDataType.VARCHAR);
  private static final Field<String> VALUE_TYPE = field(name("value_type"), SQLDataType.VARCHAR);
  private static final Field<Integer> POSITION = field(name("position"), SQLDataType.INTEGER);
  private static final Field<String> CHANGE_TYPE = field(name("change_type"), SQLDataType.VARCHAR);
  private static final Field<String> PAYLOAD = field(name("payload"), SQLDataType.VARCHAR);
  private static final Field<LocalDateTime> CREATED_AT =
      field(name("created_at"), SQLDataType.LOCALDATETIME);

  private final Table<Record> initDataTable;
  private final Table<Record> changesTable;
  private final Clock clock;

  /** Uses default table names and the UTC clock. */
  public JooqViewChangeStore() {
    this(DEFAULT_INIT_DATA_TABLE, DEFAULT_CHANGES_TABLE, Clock.systemUTC());
  }

  /**
   * @param initDataTableName name of the table keeping seeds
   * @param changesTableName name of the table keeping change streams
   * @param clock to timestamp rows with
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public JooqViewChangeStore(
      final String initDataTableName, final String changesTableName, final Clock clock) {
    this.initDataTable = table(name(requireNonNull(initDataTableName, "Init data table name")));
    this.changesTable = table(name(requireNonNull(changesTableName, "Changes table name")));
    this.clock = requireNonNull(clock, "Clock");
  }

  @Override
  public void storeInitValues(final DSLContext readWriteDsl, final List<InitViewData> initValues) {
    final DSLContext dsl = requireNonNull(readWriteDsl, "DSLContext");
    if (initValues == null || initValues.isEmpty()) {
      return;
    }

    final LocalDateTime now = LocalDateTime.now(clock);
    var insert =
        dsl.insertInto(initDataTable)
            .columns(ENTITY_ID, VIEW_NAME, VALUE_TYPE, PAYLOAD, CREATED_AT);

    for (InitViewData initValue : initValues) {
      insert =
          insert.values(
              initValue.key().value(),
              initValue.name(),
              initValue.type(),
              ViewJson.write(initValue),
              now);
    }

    final int inserted = insert.execute();
    log.debug("Stored {} view seed(s)", inserted);
  }

  @Override
  public void appendChanges(final DSLContext readWriteDsl, final ViewChangeBatch batch) {
    final DSLContext dsl = requireNonNull(readWriteDsl, "DSLContext");
    if (batch == null || batch.isEmpty()) {
      return;
    }

    final LocalDateTime now = LocalDateTime.now(clock);
    var insert =
        dsl.insertInto(changesTable)
            .columns(ENTITY_ID, VIEW_NAME, POSITION, CHANGE_TYPE, PAYLOAD, CREATED_AT);

    final List<Change> changes = batch.changes();
    for (int position = 0; position < changes.size(); position++) {
      final Change change = changes.get(position);
      insert =
          insert.values(
              batch.entityId().value(),
              batch.viewName(),
              position,
              change.getClass().getSimpleName(),
              ViewJson.write(change),
              now);
    }

    final int inserted = insert.execute();
    log.debug(
        "Appended {} change(s) to view '{}' of entity '{}'",
        inserted,
        batch.viewName(),
        batch.entityId());
  }

  /**
   * @param dsl to read with
   * @param entityId identifier of the entity owning the view
   * @param viewName name of the view
   * @return stored seed of the view
   */
  public Optional<InitViewData> readInitViewData(
      final DSLContext dsl, final EntityId entityId, final String viewName) {
    return requireNonNull(dsl, "DSLContext")
        .select(PAYLOAD)
        .from(initDataTable)
        .where(ENTITY_ID.eq(requireNonNull(entityId, "Entity id").value()))
        .and(VIEW_NAME.eq(requireNonNull(viewName, "View name")))
        .fetchOptional(PAYLOAD)
        .map(ViewJson::readInitViewData);
  }

  /**
   * @param dsl to read with
   * @param entityId identifier of the entity owning the view
   * @param viewName name of the view
   * @return change stream of the view, in the order changes were appended
   */
  public List<Change> readChanges(
      final DSLContext dsl, final EntityId entityId, final String viewName) {
    return requireNonNull(dsl, "DSLContext")
        .select(PAYLOAD)
        .from(changesTable)
        .where(ENTITY_ID.eq(requireNonNull(entityId, "Entity id").value()))
        .and(VIEW_NAME.eq(requireNonNull(viewName, "View name")))
        .orderBy(ID.asc(), POSITION.asc())
        .fetch(PAYLOAD)
        .stream()
        .map(ViewJson::readChange)
        .toList();
  }

  private static <T> T requireNonNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
