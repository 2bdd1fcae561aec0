package com.packsync.repository.jpa;

import com.packsync.entity.PerformanceEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface PerformanceJpaRepository extends JpaRepository<PerformanceEntity, String> {

    List<PerformanceEntity> findByPosEnabledTrue();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PerformanceEntity p SET p.posEnabled = :posEnabled WHERE p.internalPerformanceId = :id")
    int updatePosEnabled(@Param("id") String id, @Param("posEnabled") boolean posEnabled);
}
