package notify.batch;

import notify.Deliverable;

/**
 * Downstream consumer of the batch queue, typically the
 * {@linkplain notify.delivery.DeliveryPolicyDispatcher delivery dispatcher}.
 *
 * <p>Called from the enqueuing thread for urgent events and from the flush timer
 * otherwise. Implementations should return quickly.
 */
@FunctionalInterface
public interface DeliverableHandler {

  void handle(Deliverable deliverable);
}
