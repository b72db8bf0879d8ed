package io.github.suppierk.eventsourcing.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AggregateExceptionTest {
  static final String TYPE = "Transaction";
  static final String ID = "3f1c9f2e-7a0b-4d55-9b7e-0d6c5a1f8e21";
  static final IllegalStateException CAUSE = new IllegalStateException("boom");

  static List<AggregateException> allKinds() {
    return List.of(
        new AggregateException.AggregateConflict(TYPE, ID, "conflict"),
        new AggregateException.DatabaseConnection(TYPE, CAUSE),
        new AggregateException.Deserialization(TYPE, ID, CAUSE),
        new AggregateException.Unexpected(TYPE, CAUSE),
        new AggregateException.CommandNotConvertible(TYPE, ID, "not convertible"),
        new AggregateException.NotFound(TYPE, ID));
  }

  @Test
  void every_kind_must_have_exactly_one_exception_type() {
    final Set<AggregateException.Kind> kinds =
        allKinds().stream().map(AggregateException::kind).collect(Collectors.toSet());

    assertEquals(Set.copyOf(Arrays.asList(AggregateException.Kind.values())), kinds);
  }

  @Test
  void status_codes_must_follow_http_semantics() {
    assertEquals(409, new AggregateException.AggregateConflict(TYPE, ID, "c").getStatusCode());
    assertEquals(503, new AggregateException.DatabaseConnection(TYPE, CAUSE).getStatusCode());
    assertEquals(500, new AggregateException.Deserialization(TYPE, ID, CAUSE).getStatusCode());
    assertEquals(500, new AggregateException.Unexpected(TYPE, CAUSE).getStatusCode());
    assertEquals(
        422, new AggregateException.CommandNotConvertible(TYPE, ID, "c").getStatusCode());
    assertEquals(404, new AggregateException.NotFound(TYPE, ID).getStatusCode());
  }

  @Test
  void aggregate_type_must_always_be_reported() {
    assertTrue(allKinds().stream().allMatch(e -> e.aggregateType().orElseThrow().equals(TYPE)));
  }

  @Nested
  class Causes {
    @Test
    void storage_and_unexpected_failures_must_wrap_the_cause() {
      assertSame(CAUSE, new AggregateException.DatabaseConnection(TYPE, CAUSE).getCause());
      assertSame(CAUSE, new AggregateException.Deserialization(TYPE, ID, CAUSE).getCause());
      assertSame(CAUSE, new AggregateException.Unexpected(TYPE, CAUSE).getCause());
      assertSame(CAUSE, new AggregateException.Unexpected(TYPE, ID, CAUSE).getCause());
    }

    @Test
    void conflict_may_wrap_the_cause() {
      assertNull(new AggregateException.AggregateConflict(TYPE, ID, "c").getCause());
      assertSame(CAUSE, new AggregateException.AggregateConflict(TYPE, ID, "c", CAUSE).getCause());
    }

    @Test
    void message_only_failures_must_not_have_a_cause() {
      assertNull(new AggregateException.CommandNotConvertible(TYPE, ID, "c").getCause());
      assertNull(new AggregateException.NotFound(TYPE, ID).getCause());
    }
  }

  @Nested
  class Identifiers {
    @Test
    void when_identifier_is_known_it_must_be_reported() {
      assertEquals(ID, new AggregateException.NotFound(TYPE, ID).aggregateId().orElseThrow());
      assertEquals(
          ID, new AggregateException.Deserialization(TYPE, ID, CAUSE).aggregateId().orElseThrow());
    }

    @Test
    void when_identifier_is_unknown_it_must_be_empty() {
      assertTrue(new AggregateException.DatabaseConnection(TYPE, CAUSE).aggregateId().isEmpty());
      assertTrue(new AggregateException.Unexpected(TYPE, CAUSE).aggregateId().isEmpty());
    }

    @Test
    void not_found_message_must_name_type_and_identifier() {
      assertEquals(
          "Aggregate 'Transaction' with id '3f1c9f2e-7a0b-4d55-9b7e-0d6c5a1f8e21' was not found",
          new AggregateException.NotFound(TYPE, ID).getMessage());
    }
  }
}
