package com.storefront.orders.persistence.service;

import com.storefront.orders.core.ProductCatalog;
import com.storefront.orders.domain.ProductSnapshot;
import com.storefront.orders.persistence.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link ProductCatalog} backed by the products table. Stock changes are single conditional
 * UPDATE statements, so concurrent checkouts cannot oversell.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaProductCatalog implements ProductCatalog {

    private final ProductRepository productRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ProductSnapshot> findProduct(String productId) {
        return productRepository.findById(productId)
                .map(entity -> ProductSnapshot.builder()
                        .productId(entity.getId())
                        .name(entity.getName())
                        .price(entity.getPrice())
                        .stock(entity.getStock())
                        .build());
    }

    @Override
    @Transactional
    public boolean reserve(String productId, int quantity) {
        boolean reserved = productRepository.decrementStock(productId, quantity) == 1;
        log.debug("Stock reserve productId={} quantity={} reserved={}", productId, quantity, reserved);
        return reserved;
    }

    @Override
    @Transactional
    public void release(String productId, int quantity) {
        int updated = productRepository.incrementStock(productId, quantity);
        if (updated == 0) {
            log.warn("Stock release for unknown productId={} quantity={}", productId, quantity);
        }
    }
}
