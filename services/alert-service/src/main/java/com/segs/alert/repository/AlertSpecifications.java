package com.segs.alert.repository;

import com.segs.alert.entity.Alert;
import com.segs.alert.service.AlertFilter;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Criteria for {@link AlertFilter}. Unset fields do not constrain the result.
 */
public final class AlertSpecifications {

    private AlertSpecifications() {
    }

    public static Specification<Alert> matching(AlertFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getType() != null) {
                predicates.add(cb.equal(root.get("type"), filter.getType()));
            }
            if (filter.getSeverity() != null) {
                predicates.add(cb.equal(root.get("severity"), filter.getSeverity()));
            }
            if (filter.getRegion() != null) {
                predicates.add(cb.equal(root.get("region"), filter.getRegion()));
            }
            if (filter.getMeterId() != null) {
                predicates.add(cb.equal(root.get("meterId"), filter.getMeterId()));
            }
            if (filter.getAcknowledged() != null) {
                predicates.add(cb.equal(root.get("acknowledged"), filter.getAcknowledged()));
            }
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), filter.getTo()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
