package com.portfoliosync.repository.jpa;

import com.portfoliosync.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    List<PositionEntity> findByAccountIdOrderByTradingSymbolAsc(Long accountId);

    @Modifying
    @Query("DELETE FROM PositionEntity p WHERE p.accountId = :accountId")
    int deleteAllForAccount(@Param("accountId") Long accountId);
}
