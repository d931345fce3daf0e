package com.ledger.order.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.ledger.order.readmodel.OrderView;

@Repository
public interface OrderViewRepository extends JpaRepository<OrderView, String> {
}
