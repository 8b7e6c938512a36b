package com.storefront.orders.persistence.repository;

import com.storefront.orders.domain.RefundStatus;
import com.storefront.orders.persistence.entity.RefundEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Spring Data repository for the refund ledger. */
@Repository
public interface RefundRepository extends JpaRepository<RefundEntity, String> {

    Optional<RefundEntity> findByRefundIdempotencyKey(String refundIdempotencyKey);

    List<RefundEntity> findByOrderId(String orderId);

    @Query("SELECT SUM(r.amount) FROM RefundEntity r WHERE r.orderId = :orderId AND r.status IN :statuses")
    BigDecimal sumRefundedAmountByOrder(@Param("orderId") String orderId,
                                        @Param("statuses") Collection<RefundStatus> statuses);
}
