package com.rxgate.fulfillmentservice.service;

import com.rxgate.fulfillmentservice.model.Order;
import com.rxgate.fulfillmentservice.model.OrderItem;
import com.rxgate.fulfillmentservice.model.ProviderOfferId;
import com.rxgate.fulfillmentservice.repository.ProviderOfferRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns reserved medication stock to provider offers when an order is
 * abandoned. Always runs inside the caller's transaction, so a failure rolls
 * the releases back together with the order update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryReleaseService {

    private final ProviderOfferRepository providerOfferRepository;

    /**
     * Increments stock once per offer by the summed reserved quantity and clears
     * the reserved flag on each item, so calling this twice releases nothing the
     * second time.
     *
     * @return total units returned to stock
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int releaseReservations(Order order) {
        Map<ProviderOfferId, Integer> quantities = new LinkedHashMap<>();
        for (OrderItem item : order.getItems()) {
            if (!item.isReserved() || !item.getOffer().getCatalogItem().getKind().isStockable()) {
                continue;
            }
            quantities.merge(item.getOffer().getId(), item.getQuantity(), Integer::sum);
            item.setReserved(false);
        }

        int released = 0;
        for (Map.Entry<ProviderOfferId, Integer> entry : quantities.entrySet()) {
            ProviderOfferId offerId = entry.getKey();
            int updated = providerOfferRepository.increaseStock(
                    offerId.getProviderId(), offerId.getCatalogItemId(), entry.getValue());
            if (updated == 0) {
                // offer is gone or not stock-tracked any more; nothing to give back to
                log.warn("Stock release skipped, offer not found: orderId={}, providerId={}, catalogItemId={}",
                        order.getId(), offerId.getProviderId(), offerId.getCatalogItemId());
                continue;
            }
            released += entry.getValue();
            log.info("Stock released: orderId={}, providerId={}, catalogItemId={}, quantity={}",
                    order.getId(), offerId.getProviderId(), offerId.getCatalogItemId(), entry.getValue());
        }
        return released;
    }
}
