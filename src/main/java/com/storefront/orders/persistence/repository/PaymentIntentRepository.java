package com.storefront.orders.persistence.repository;

import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.persistence.entity.PaymentIntentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntentEntity, String> {

    Optional<PaymentIntentEntity> findByExternalReference(String externalReference);

    List<PaymentIntentEntity> findByOrderIdOrderByCreatedAtDesc(String orderId);

    Optional<PaymentIntentEntity> findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(String orderId,
                                                                                 Collection<IntentStatus> statuses);
}
