package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.XpTransaction;
import com.aiinpocket.choretrust.model.enums.XpTransactionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface XpTransactionRepository extends JpaRepository<XpTransaction, Long> {

    List<XpTransaction> findByUserIdOrderByCreatedAtDescIdDesc(UUID userId, Pageable pageable);

    List<XpTransaction> findByUserIdAndRelatedTaskId(UUID userId, UUID relatedTaskId);

    long countByUserIdAndType(UUID userId, XpTransactionType type);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM XpTransaction t " +
            "WHERE t.userId = :userId AND t.type IN :types AND t.createdAt >= :from AND t.createdAt < :to")
    long sumAmount(@Param("userId") UUID userId,
                   @Param("types") List<XpTransactionType> types,
                   @Param("from") Instant from,
                   @Param("to") Instant to);
}
