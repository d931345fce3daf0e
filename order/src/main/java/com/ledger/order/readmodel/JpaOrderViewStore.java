package com.ledger.order.readmodel;

import com.ledger.order.repository.OrderSummaryRepository;
import com.ledger.order.repository.OrderViewRepository;
import com.ledger.shared.support.StorageUnavailableException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed read-model store. Views live in {@code order_views} with their nested
 * collections in jsonb columns; the summary is the single row of {@code order_summary}.
 *
 * Filtering and pagination run in the database (Criteria API, LIMIT/OFFSET).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.read-model.store", havingValue = "jpa", matchIfMissing = true)
public class JpaOrderViewStore implements OrderViewStore {

    private final OrderViewRepository viewRepository;
    private final OrderSummaryRepository summaryRepository;
    private final EntityManager entityManager;

    @Override
    @Transactional
    public void save(OrderView view) {
        execute("save view", () -> viewRepository.save(view));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderView> findById(String orderId) {
        return execute("find view", () -> viewRepository.findById(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderPage find(OrderQuery query) {
        return execute("find views", () -> {
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();

            CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
            Root<OrderView> countRoot = countQuery.from(OrderView.class);
            countQuery.select(cb.count(countRoot)).where(predicates(cb, countRoot, query));
            long total = entityManager.createQuery(countQuery).getSingleResult();

            CriteriaQuery<OrderView> select = cb.createQuery(OrderView.class);
            Root<OrderView> root = select.from(OrderView.class);
            select.select(root)
                    .where(predicates(cb, root, query))
                    .orderBy(cb.desc(root.get("orderDate")), cb.desc(root.get("orderId")));

            var typed = entityManager.createQuery(select).setFirstResult(query.offsetOrZero());
            if (query.limit() != null) {
                typed.setMaxResults(query.limit());
            }
            List<OrderView> items = typed.getResultList();
            int limit = query.limit() == null ? (int) total : query.limit();
            return new OrderPage(items, total, limit, query.offsetOrZero());
        });
    }

    private static Predicate[] predicates(CriteriaBuilder cb, Root<OrderView> root, OrderQuery query) {
        List<Predicate> predicates = new ArrayList<>();
        if (query.status() != null) {
            predicates.add(cb.equal(root.get("status"), query.status()));
        }
        if (query.customerEmail() != null) {
            predicates.add(cb.equal(root.get("customerEmail"), query.customerEmail()));
        }
        if (query.fromDate() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.get("orderDate"), query.fromDate()));
        }
        if (query.toDate() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.get("orderDate"), query.toDate()));
        }
        if (query.minAmount() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.get("totalAmount"), query.minAmount()));
        }
        if (query.maxAmount() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.get("totalAmount"), query.maxAmount()));
        }
        return predicates.toArray(new Predicate[0]);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderView> findAll() {
        return execute("find all views",
                () -> viewRepository.findAll(Sort.by("orderDate").ascending().and(Sort.by("orderId"))));
    }

    @Override
    @Transactional
    public void deleteById(String orderId) {
        execute("delete view", () -> {
            viewRepository.deleteById(orderId);
            return null;
        });
    }

    @Override
    @Transactional
    public void saveSummary(OrderSummaryView summary) {
        execute("save summary", () -> summaryRepository.save(summary));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderSummaryView> findSummary() {
        return execute("find summary", () -> summaryRepository.findById(OrderSummaryView.SINGLETON_ID));
    }

    @Override
    @Transactional
    public void deleteAll() {
        execute("clear read models", () -> {
            viewRepository.deleteAllInBatch();
            summaryRepository.deleteAllInBatch();
            return null;
        });
        log.info("Read models cleared");
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Read-model store failed: operation={}", operation, e);
            throw new StorageUnavailableException("Read-model store unavailable during " + operation, e);
        }
    }
}
