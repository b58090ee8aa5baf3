package com.rxgate.fulfillmentservice.service;

import com.rxgate.common.exception.ResourceNotFoundException;
import com.rxgate.fulfillmentservice.model.CatalogItem;
import com.rxgate.fulfillmentservice.repository.CatalogItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only access to catalog items (medications and lab/diagnostic services).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogService {

    private final CatalogItemRepository catalogItemRepository;

    public CatalogItem resolveCatalogItem(Long id) {
        return catalogItemRepository.findById(id)
                .orElseThrow(() -> {
                    log.warn("Catalog item not found: catalogItemId={}", id);
                    return new ResourceNotFoundException("Catalog item not found with id: " + id);
                });
    }

    /**
     * Resolves every id or fails naming the missing ones.
     */
    public Map<Long, CatalogItem> resolveAll(Collection<Long> ids) {
        Set<Long> requested = new LinkedHashSet<>(ids);
        Map<Long, CatalogItem> found = catalogItemRepository.findAllById(requested).stream()
                .collect(Collectors.toMap(CatalogItem::getId, Function.identity()));

        if (found.size() != requested.size()) {
            Set<Long> missing = requested.stream()
                    .filter(id -> !found.containsKey(id))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            log.warn("Catalog items not found: catalogItemIds={}", missing);
            throw new ResourceNotFoundException("Catalog items not found with ids: " + missing);
        }
        return found;
    }
}
