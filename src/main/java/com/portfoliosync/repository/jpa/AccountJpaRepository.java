package com.portfoliosync.repository.jpa;

import com.portfoliosync.entity.AccountEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the accounts table.
 * Sync-all walks the active accounts in id order.
 */
@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findByName(String name);

    List<AccountEntity> findByActiveTrueOrderByIdAsc();
}
