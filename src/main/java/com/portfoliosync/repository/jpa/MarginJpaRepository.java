package com.portfoliosync.repository.jpa;

import com.portfoliosync.entity.MarginEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the margins table (one row per account).
 */
@Repository
public interface MarginJpaRepository extends JpaRepository<MarginEntity, Long> {

    Optional<MarginEntity> findByAccountId(Long accountId);

    @Modifying
    @Query("DELETE FROM MarginEntity m WHERE m.accountId = :accountId")
    int deleteAllForAccount(@Param("accountId") Long accountId);
}
