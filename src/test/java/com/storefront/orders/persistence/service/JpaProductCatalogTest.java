package com.storefront.orders.persistence.service;

import com.storefront.orders.domain.ProductSnapshot;
import com.storefront.orders.persistence.entity.ProductEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaProductCatalog.class)
class JpaProductCatalogTest {

    @Autowired
    private JpaProductCatalog catalog;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void stockShelf() {
        entityManager.persistAndFlush(ProductEntity.builder()
                .id("prod-mouse").name("Mouse").price(new BigDecimal("5.00")).stock(3).build());
    }

    @Test
    void reservationNeverTakesStockBelowZero() {
        assertThat(catalog.reserve("prod-mouse", 2)).isTrue();
        assertThat(catalog.reserve("prod-mouse", 2)).isFalse();
        entityManager.clear();

        assertThat(catalog.findProduct("prod-mouse")).map(ProductSnapshot::getStock).contains(1);
    }

    @Test
    void releaseGivesStockBack() {
        catalog.reserve("prod-mouse", 3);
        catalog.release("prod-mouse", 3);
        entityManager.clear();

        assertThat(catalog.findProduct("prod-mouse")).map(ProductSnapshot::getStock).contains(3);
    }

    @Test
    void unknownProductIsAbsent() {
        assertThat(catalog.findProduct("prod-ghost")).isEmpty();
        assertThat(catalog.reserve("prod-ghost", 1)).isFalse();
    }
}
