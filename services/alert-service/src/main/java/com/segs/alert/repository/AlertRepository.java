package com.segs.alert.repository;

import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Alert entities
 */
@Repository
public interface AlertRepository extends JpaRepository<Alert, UUID>, JpaSpecificationExecutor<Alert> {

    // Rows of the given ids that can still be resolved, locked until commit
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Alert a WHERE a.id IN :ids AND a.status <> :resolved ORDER BY a.createdAt DESC")
    List<Alert> lockUnresolvedByIds(@Param("ids") Collection<UUID> ids,
                                    @Param("resolved") AlertStatus resolved);

    // Active rows created before the cutoff, locked until commit
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Alert a WHERE a.status = :status AND a.createdAt < :cutoff ORDER BY a.createdAt")
    List<Alert> lockByStatusCreatedBefore(@Param("status") AlertStatus status,
                                          @Param("cutoff") Instant cutoff);

    @Query("SELECT a.type, COUNT(a) FROM Alert a " +
           "WHERE (:region IS NULL OR a.region = :region) GROUP BY a.type")
    List<Object[]> countByType(@Param("region") String region);

    @Query("SELECT a.region, COUNT(a) FROM Alert a " +
           "WHERE a.region IS NOT NULL AND (:region IS NULL OR a.region = :region) GROUP BY a.region")
    List<Object[]> countByRegion(@Param("region") String region);

    // Average hours between creation and resolution over resolved rows
    @Query(value = "SELECT CAST(AVG(EXTRACT(EPOCH FROM (resolved_at - created_at)) / 3600) AS double precision) FROM alerts " +
                   "WHERE resolved_at IS NOT NULL AND (CAST(:region AS varchar) IS NULL OR region = :region)",
           nativeQuery = true)
    Double averageResolutionHours(@Param("region") String region);
}
