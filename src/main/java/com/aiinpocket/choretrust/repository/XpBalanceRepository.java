package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.XpBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface XpBalanceRepository extends JpaRepository<XpBalance, Long> {

    Optional<XpBalance> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);

    /** 以 SELECT ... FOR UPDATE 取得餘額，同一使用者的異動依序執行 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM XpBalance b WHERE b.userId = :userId")
    Optional<XpBalance> lockByUserId(@Param("userId") UUID userId);
}
