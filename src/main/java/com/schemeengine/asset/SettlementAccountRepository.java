package com.schemeengine.asset;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for internal settlement asset accounts.
 */
@Repository
public interface SettlementAccountRepository extends JpaRepository<SettlementAccount, String> {

    /**
     * Load an account for a balance change, holding its row lock until the
     * surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from SettlementAccount a where a.holder = :holder")
    Optional<SettlementAccount> findForUpdate(@Param("holder") String holder);
}
