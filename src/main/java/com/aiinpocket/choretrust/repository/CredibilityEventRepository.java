package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.CredibilityEvent;
import com.aiinpocket.choretrust.model.enums.CredibilityEventType;
import com.aiinpocket.choretrust.model.enums.DecayStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CredibilityEventRepository extends JpaRepository<CredibilityEvent, Long> {

    /** 有效歷史（不含已封存的扣分紀錄） */
    List<CredibilityEvent> findByUserIdAndArchivedFalseOrderByCreatedAtAscIdAsc(UUID userId);

    List<CredibilityEvent> findByUserIdAndEventTypeOrderByCreatedAtAscIdAsc(UUID userId, CredibilityEventType eventType);

    /** 疊加扣分判斷：最近一筆尚未衰減、未撤銷的扣分 */
    Optional<CredibilityEvent> findFirstByUserIdAndEventTypeAndDecayStageAndReversedFalseOrderByCreatedAtDescIdDesc(
            UUID userId, CredibilityEventType eventType, DecayStage decayStage);

    Optional<CredibilityEvent> findFirstByUserIdAndTaskIdAndEventTypeAndReversedFalseOrderByCreatedAtDescIdDesc(
            UUID userId, UUID taskId, CredibilityEventType eventType);

    @Query("SELECT DISTINCT e.userId FROM CredibilityEvent e " +
            "WHERE e.eventType = com.aiinpocket.choretrust.model.enums.CredibilityEventType.DOWNVOTE " +
            "AND e.reversed = false " +
            "AND e.decayStage <> com.aiinpocket.choretrust.model.enums.DecayStage.FULL " +
            "AND e.createdAt <= :cutoff")
    List<UUID> findUserIdsWithDecayableDownvotes(@Param("cutoff") Instant cutoff);

    @Query("SELECT e FROM CredibilityEvent e " +
            "WHERE e.userId = :userId " +
            "AND e.eventType = com.aiinpocket.choretrust.model.enums.CredibilityEventType.DOWNVOTE " +
            "AND e.reversed = false " +
            "AND e.decayStage <> com.aiinpocket.choretrust.model.enums.DecayStage.FULL " +
            "AND e.createdAt <= :cutoff " +
            "ORDER BY e.createdAt ASC, e.id ASC")
    List<CredibilityEvent> findDecayableDownvotes(@Param("userId") UUID userId, @Param("cutoff") Instant cutoff);
}
