package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.eventsourcing.jooq.StorageTables.AGGREGATE_ID;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.AGGREGATE_TYPE;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.CREATED_AT;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.PAYLOAD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.error.AggregateException;
import io.github.suppierk.eventsourcing.json.JsonCodec;
import io.github.suppierk.test.transaction.Item;
import io.github.suppierk.test.transaction.ItemStatus;
import io.github.suppierk.test.transaction.Transaction;
import io.github.suppierk.test.transaction.TransactionHandler;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqRepositoryTest {
  static final String TYPE = "Transaction";
  static final String ID = "3f1c9f2e-7a0b-4d55-9b7e-0d6c5a1f8e21";
  static final StorageTables TABLES = StorageTables.defaults();
  static final DSLContext DSL_CONTEXT = H2Database.open("jooq_repository");

  static final Transaction TRANSACTION =
      new Transaction(
          ID,
          List.of(new Item("A-100", "Keyboard", 30000), new Item("B-200", "Monitor", 550000)),
          580000);

  static JooqRepository<Transaction> repository(final DSLContext dslContext) {
    return JooqRepository.forHandler(
        new TransactionHandler(), DslContextProvider.dslContextIdentity(dslContext));
  }

  @BeforeEach
  void cleanUp() {
    DSL_CONTEXT.deleteFrom(TABLES.aggregates()).execute();
  }

  @Test
  void when_arguments_are_null_illegal_argument_exception_is_thrown() {
    final var provider = DslContextProvider.dslContextIdentity(DSL_CONTEXT);
    final var codec = JsonCodec.defaultCodec();
    final var clock = Clock.systemUTC();

    assertThrows(IllegalArgumentException.class, () -> JooqRepository.forHandler(null, provider));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new JooqRepository<>(
                TYPE, Transaction.class, null, TABLES, codec, Runnable::run, clock));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new JooqRepository<>(
                " ", Transaction.class, provider, TABLES, codec, Runnable::run, clock));
    assertThrows(IllegalArgumentException.class, () -> repository(DSL_CONTEXT).add(null));
    assertThrows(IllegalArgumentException.class, () -> repository(DSL_CONTEXT).get(null));
  }

  @Nested
  class Add {
    @Test
    void when_aggregate_is_new_it_must_be_stored() {
      final var repository = repository(DSL_CONTEXT);

      assertEquals(ID, repository.add(TRANSACTION).join());
      assertEquals(TRANSACTION, repository.get(ID).join());
    }

    @Test
    void when_aggregate_is_present_existing_record_must_stay_untouched() {
      final var repository = repository(DSL_CONTEXT);
      final var changed =
          new Transaction(
              ID,
              TRANSACTION.items().stream()
                  .map(item -> item.withStatus(ItemStatus.CANCELLED))
                  .toList(),
              TRANSACTION.payAmount());

      repository.add(TRANSACTION).join();

      assertEquals(ID, repository.add(changed).join());
      assertEquals(TRANSACTION, repository.get(ID).join());
      assertEquals(1, DSL_CONTEXT.fetchCount(TABLES.aggregates()));
    }

    @Test
    void when_record_is_inserted_concurrently_existing_record_must_win() {
      final var otherWriter = repository(H2Database.open("jooq_repository"));
      final var racing =
          H2Database.racingAfter(
              DSL_CONTEXT,
              sql -> sql.startsWith("select") && sql.contains("es_aggregates"),
              () -> otherWriter.add(TRANSACTION).join());
      final var changed =
          new Transaction(
              ID,
              TRANSACTION.items().stream()
                  .map(item -> item.withStatus(ItemStatus.CANCELLED))
                  .toList(),
              TRANSACTION.payAmount());

      assertEquals(ID, repository(racing).add(changed).join());
      assertEquals(TRANSACTION, repository(DSL_CONTEXT).get(ID).join());
      assertEquals(1, DSL_CONTEXT.fetchCount(TABLES.aggregates()));
    }

    @Test
    void aggregates_of_different_types_must_not_collide() {
      final var other =
          new JooqRepository<>(
              "Order",
              Transaction.class,
              DslContextProvider.dslContextIdentity(DSL_CONTEXT),
              TABLES,
              JsonCodec.defaultCodec(),
              Runnable::run,
              Clock.systemUTC());

      repository(DSL_CONTEXT).add(TRANSACTION).join();
      other.add(TRANSACTION).join();

      assertEquals(2, DSL_CONTEXT.fetchCount(TABLES.aggregates()));
    }

    @Test
    void when_database_is_unreachable_database_connection_error_is_reported() {
      final var future = repository(H2Database.closed("jooq_repository_closed")).add(TRANSACTION);

      final var exception = assertThrows(CompletionException.class, future::join);
      assertInstanceOf(AggregateException.DatabaseConnection.class, exception.getCause());
    }
  }

  @Nested
  class Get {
    @Test
    void when_aggregate_is_unknown_not_found_error_is_reported() {
      final var future = repository(DSL_CONTEXT).get("unknown");

      final var exception = assertThrows(CompletionException.class, future::join);
      final var notFound =
          assertInstanceOf(AggregateException.NotFound.class, exception.getCause());
      assertEquals("unknown", notFound.aggregateId().orElseThrow());
    }

    @Test
    void when_record_is_corrupt_deserialization_error_is_reported() {
      store(ID, "{\"aggregateId\":");

      final var future = repository(DSL_CONTEXT).get(ID);

      final var exception = assertThrows(CompletionException.class, future::join);
      assertInstanceOf(AggregateException.Deserialization.class, exception.getCause());
    }

    @Test
    void when_record_describes_another_aggregate_deserialization_error_is_reported() {
      store("another", JsonCodec.defaultCodec().write(TYPE, TRANSACTION));

      final var future = repository(DSL_CONTEXT).get("another");

      final var exception = assertThrows(CompletionException.class, future::join);
      assertInstanceOf(AggregateException.Deserialization.class, exception.getCause());
    }

    @Test
    void when_database_is_unreachable_database_connection_error_is_reported() {
      final var future = repository(H2Database.closed("jooq_repository_closed")).get(ID);

      final var exception = assertThrows(CompletionException.class, future::join);
      assertInstanceOf(AggregateException.DatabaseConnection.class, exception.getCause());
    }

    void store(final String aggregateId, final String payload) {
      DSL_CONTEXT
          .insertInto(TABLES.aggregates())
          .set(AGGREGATE_TYPE, TYPE)
          .set(AGGREGATE_ID, aggregateId)
          .set(PAYLOAD, payload)
          .set(CREATED_AT, OffsetDateTime.now())
          .execute();
    }
  }
}
