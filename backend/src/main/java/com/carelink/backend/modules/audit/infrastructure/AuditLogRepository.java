package com.carelink.backend.modules.audit.infrastructure;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.audit.domain.AuditLog;

import jakarta.persistence.criteria.Predicate;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID>, JpaSpecificationExecutor<AuditLog> {

    @Override
    @EntityGraph(attributePaths = "user")
    Page<AuditLog> findAll(Specification<AuditLog> spec, Pageable pageable);

    /**
     * Filters on whichever of user and action is given. Absent filters add no predicate, so no
     * untyped null parameter reaches the database.
     */
    static Specification<AuditLog> matching(UUID userId, AuditAction action) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (userId != null) {
                predicates.add(cb.equal(root.get("user").get("id"), userId));
            }
            if (action != null) {
                predicates.add(cb.equal(root.get("action"), action));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
