package com.storefront.orders.persistence.repository;

import com.storefront.orders.persistence.entity.ReturnRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReturnRequestRepository extends JpaRepository<ReturnRequestEntity, String> {

    List<ReturnRequestEntity> findByOrderIdOrderByRequestDateDesc(String orderId);

    long countByRequestNumberStartingWith(String prefix);
}
