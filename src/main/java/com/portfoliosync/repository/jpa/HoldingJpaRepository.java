package com.portfoliosync.repository.jpa;

import com.portfoliosync.entity.HoldingEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the holdings table.
 * Rows are only ever replaced per account; there is no per-row update path.
 */
@Repository
public interface HoldingJpaRepository extends JpaRepository<HoldingEntity, Long> {

    List<HoldingEntity> findByAccountIdOrderByTradingSymbolAsc(Long accountId);

    /** Bulk delete without loading the rows. Must run inside the caller's transaction. */
    @Modifying
    @Query("DELETE FROM HoldingEntity h WHERE h.accountId = :accountId")
    int deleteAllForAccount(@Param("accountId") Long accountId);
}
