package com.schemeengine.scheme;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for scheme persistence.
 */
@Repository
public interface SchemeRepository extends JpaRepository<Scheme, String> {

    Optional<Scheme> findBySchemeId(String schemeId);

    /**
     * Load a scheme for mutation. The row lock serializes mutating calls on one
     * scheme until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Scheme s where s.schemeId = :schemeId")
    Optional<Scheme> findForUpdate(@Param("schemeId") String schemeId);

    List<Scheme> findByState(SchemeState state);
}
