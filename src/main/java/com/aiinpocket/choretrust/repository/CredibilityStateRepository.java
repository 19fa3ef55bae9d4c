package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.CredibilityState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CredibilityStateRepository extends JpaRepository<CredibilityState, Long> {

    Optional<CredibilityState> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM CredibilityState s WHERE s.userId = :userId")
    Optional<CredibilityState> lockByUserId(@Param("userId") UUID userId);

    @Query("SELECT s.userId FROM CredibilityState s " +
            "WHERE s.hasRedemptionBonus = true AND s.redemptionBonusExpiry < :now")
    List<UUID> findUserIdsWithExpiredRedemptionBonus(@Param("now") Instant now);
}
