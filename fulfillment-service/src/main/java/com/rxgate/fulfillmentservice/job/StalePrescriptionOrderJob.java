package com.rxgate.fulfillmentservice.job;

import com.rxgate.fulfillmentservice.config.FulfillmentProperties;
import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderStatus;
import com.rxgate.fulfillmentservice.repository.OrderRepository;
import com.rxgate.fulfillmentservice.service.InventoryReleaseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Cancels orders that have waited on prescription review longer than the
 * configured timeout and gives their reserved stock back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StalePrescriptionOrderJob {

    static final String TIMEOUT_REASON = "Prescription verification timeout";

    private final OrderRepository orderRepository;
    private final InventoryReleaseService inventoryReleaseService;
    private final FulfillmentProperties properties;

    @Scheduled(cron = "${fulfillment.cleanup.cron:0 0 0 * * *}")
    @Transactional
    public int cancelStaleOrders() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(properties.getCleanup().getPrescriptionTimeout());
        List<Order> orders = orderRepository.findByStatusAndCreatedAtBefore(OrderStatus.PENDING_PRESCRIPTION, cutoff);

        if (orders.isEmpty()) {
            log.debug("No stale prescription orders older than {}", cutoff);
            return 0;
        }

        for (Order order : orders) {
            order.setStatus(OrderStatus.CANCELLED);
            order.setCancelReason(TIMEOUT_REASON);
            order.setCancelledAt(now);
            int released = inventoryReleaseService.releaseReservations(order);
            log.info("Order cancelled on prescription timeout: orderId={}, unitsReleased={}", order.getId(), released);
        }
        orderRepository.saveAll(orders);

        log.info("Stale prescription order cleanup completed: cancelledOrders={}", orders.size());
        return orders.size();
    }
}
