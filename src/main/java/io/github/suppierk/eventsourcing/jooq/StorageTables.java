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

package io.github.suppierk.eventsourcing.jooq;

import java.time.OffsetDateTime;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Physical layout used by the jOOQ storage adapters.
 *
 * <p>Both tables are namespaced by the aggregate type, so different aggregate kinds can share them.
 * The expected DDL is shipped as {@code io/github/suppierk/eventsourcing/jooq/schema.sql}.
 */
public final class StorageTables {
  public static final String DEFAULT_AGGREGATES_TABLE = "es_aggregates";
  public static final String DEFAULT_EVENTS_TABLE = "es_events";

  static final Field<String> AGGREGATE_TYPE =
      DSL.field(DSL.name("aggregate_type"), SQLDataType.VARCHAR(255).nullable(false));
  static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR(255).nullable(false));
  static final Field<String> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.CLOB.nullable(false));
  static final Field<OffsetDateTime> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false));

  static final Field<Long> SEQUENCE_NUMBER =
      DSL.field(DSL.name("sequence_number"), SQLDataType.BIGINT.nullable(false));
  static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(255).nullable(false));
  static final Field<String> EVENT_VERSION =
      DSL.field(DSL.name("event_version"), SQLDataType.VARCHAR(64).nullable(false));
  static final Field<OffsetDateTime> RECORDED_AT =
      DSL.field(DSL.name("recorded_at"), SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false));

  private final Table<Record> aggregates;
  private final Table<Record> events;

  /**
   * @param aggregatesTable name of the table keeping aggregate snapshots
   * @param eventsTable name of the table keeping event streams
   * @throws IllegalArgumentException if any of the names is null or blank
   */
  public StorageTables(final String aggregatesTable, final String eventsTable) {
    if (aggregatesTable == null || aggregatesTable.isBlank()) {
      throw new IllegalArgumentException("Aggregates table name cannot be blank");
    }

    if (eventsTable == null || eventsTable.isBlank()) {
      throw new IllegalArgumentException("Events table name cannot be blank");
    }

    this.aggregates = DSL.table(DSL.name(aggregatesTable));
    this.events = DSL.table(DSL.name(eventsTable));
  }

  /**
   * @return tables with {@link #DEFAULT_AGGREGATES_TABLE} and {@link #DEFAULT_EVENTS_TABLE} names
   */
  public static StorageTables defaults() {
    return new StorageTables(DEFAULT_AGGREGATES_TABLE, DEFAULT_EVENTS_TABLE);
  }

  Table<Record> aggregates() {
    return aggregates;
  }

  Table<Record> events() {
    return events;
  }
}
