package io.github.suppierk.test.transaction;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TransactionEvent.PurchaseMade.class, name = "PurchaseMade"),
  @JsonSubTypes.Type(
      value = TransactionEvent.CancellationRequested.class,
      name = "CancellationRequested")
})
public sealed interface TransactionEvent extends DomainEvent<Transaction>
    permits TransactionEvent.PurchaseMade, TransactionEvent.CancellationRequested {

  record PurchaseMade(String transactionId, List<Item> items)
      implements TransactionEvent, DomainEvent.Creation<Transaction> {
    public PurchaseMade {
      items = List.copyOf(items);
    }

    @Override
    public Transaction create() {
      return new Transaction(
          transactionId, items, items.stream().mapToLong(Item::sellPrice).sum());
    }
  }

  record CancellationRequested(String transactionId, String productId)
      implements TransactionEvent, DomainEvent.Mutation<Transaction> {
    @Override
    public Transaction applyTo(Transaction existing) {
      if (!existing.aggregateId().equals(transactionId)) {
        return existing;
      }

      return new Transaction(
          existing.aggregateId(),
          existing.items().stream()
              .map(
                  item ->
                      item.productId().equals(productId)
                          ? item.withStatus(ItemStatus.CANCELLED)
                          : item)
              .toList(),
          existing.payAmount());
    }
  }
}
