package io.github.suppierk.eventsourcing.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.error.AggregateException;
import io.github.suppierk.test.transaction.Item;
import io.github.suppierk.test.transaction.TransactionEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryEventJournalTest {
  static final String ID = "3f1c9f2e-7a0b-4d55-9b7e-0d6c5a1f8e21";
  static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123456Z");

  static final TransactionEvent PURCHASE =
      new TransactionEvent.PurchaseMade(
          ID, List.of(new Item("A-100", "Keyboard", 30000), new Item("B-200", "Monitor", 550000)));
  static final TransactionEvent CANCELLATION =
      new TransactionEvent.CancellationRequested(ID, "A-100");

  static InMemoryEventJournal<TransactionEvent> journal() {
    return new InMemoryEventJournal<>(
        "Transaction", Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void when_arguments_are_null_illegal_argument_exception_is_thrown() {
    final var journal = journal();

    assertThrows(IllegalArgumentException.class, () -> new InMemoryEventJournal<>(null));
    assertThrows(IllegalArgumentException.class, () -> journal.append(null, 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> journal.append(ID, 0, null));
    assertThrows(IllegalArgumentException.class, () -> journal.load(null));
    assertThrows(IllegalArgumentException.class, () -> journal.load(" "));
  }

  @Nested
  class Append {
    @Test
    void sequences_must_start_at_one_and_have_no_gaps() {
      final var journal = journal();

      final var first = journal.append(ID, 0, List.of(PURCHASE)).join();
      final var second = journal.append(ID, 1, List.of(CANCELLATION, CANCELLATION)).join();

      assertEquals(1, first.get(0).sequence());
      assertEquals(List.of(2L, 3L), second.stream().map(EventEnvelope::sequence).toList());
    }

    @Test
    void envelopes_must_carry_event_tags() {
      final var envelope = journal().append(ID, 0, List.of(PURCHASE)).join().get(0);

      assertEquals("Transaction", envelope.aggregateType());
      assertEquals(ID, envelope.aggregateId());
      assertEquals("PurchaseMade", envelope.eventType());
      assertEquals("1.0.0", envelope.eventVersion());
      assertEquals(NOW, envelope.recordedAt());
      assertEquals(PURCHASE, envelope.event());
    }

    @Test
    void when_expected_sequence_is_stale_conflict_is_reported_and_nothing_is_appended() {
      final var journal = journal();
      journal.append(ID, 0, List.of(PURCHASE)).join();

      final var future = journal.append(ID, 0, List.of(CANCELLATION));

      final var exception = assertThrows(CompletionException.class, future::join);
      final var conflict =
          assertInstanceOf(AggregateException.AggregateConflict.class, exception.getCause());
      assertEquals(ID, conflict.aggregateId().orElseThrow());
      assertEquals(1, journal.load(ID).join().size());
    }

    @Test
    void when_expected_sequence_is_ahead_conflict_is_reported() {
      final var future = journal().append(ID, 5, List.of(PURCHASE));

      final var exception = assertThrows(CompletionException.class, future::join);
      assertInstanceOf(AggregateException.AggregateConflict.class, exception.getCause());
    }

    @Test
    void when_events_are_empty_nothing_is_appended() {
      final var journal = journal();

      assertTrue(journal.append(ID, 0, List.of()).join().isEmpty());
      assertTrue(journal.load(ID).join().isEmpty());
    }
  }

  @Nested
  class Load {
    @Test
    void when_stream_is_unknown_empty_list_is_returned() {
      assertTrue(journal().load("unknown").join().isEmpty());
    }

    @Test
    void events_must_be_returned_in_append_order() {
      final var journal = journal();
      journal.append(ID, 0, List.of(PURCHASE)).join();
      journal.append(ID, 1, List.of(CANCELLATION)).join();

      final var events = journal.load(ID).join().stream().map(EventEnvelope::event).toList();

      assertEquals(List.of(PURCHASE, CANCELLATION), events);
    }

    @Test
    void streams_must_be_independent() {
      final var journal = journal();
      journal.append(ID, 0, List.of(PURCHASE)).join();

      assertTrue(journal.load("another").join().isEmpty());
      assertEquals(1, journal.append("another", 0, List.of(PURCHASE)).join().get(0).sequence());
    }
  }
}
