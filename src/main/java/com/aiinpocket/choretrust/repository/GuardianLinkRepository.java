package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.GuardianLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface GuardianLinkRepository extends JpaRepository<GuardianLink, Long> {

    boolean existsByGuardianIdAndChildId(UUID guardianId, UUID childId);

    @Query("SELECT l.childId FROM GuardianLink l WHERE l.guardianId = :guardianId")
    List<UUID> findChildIdsByGuardianId(@Param("guardianId") UUID guardianId);
}
