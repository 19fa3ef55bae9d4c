package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.EarnedBadge;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EarnedBadgeRepository extends JpaRepository<EarnedBadge, Long> {

    List<EarnedBadge> findByChildIdOrderByEarnedAtDesc(UUID childId);

    boolean existsByChildIdAndBadge(UUID childId, BadgeDef badge);
}
