package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.TaskAssignment;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskAssignmentRepository extends JpaRepository<TaskAssignment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TaskAssignment a WHERE a.id = :id")
    Optional<TaskAssignment> lockById(@Param("id") UUID id);

    List<TaskAssignment> findByChildIdOrderByCreatedAtDesc(UUID childId);

    List<TaskAssignment> findByChildIdAndStatusOrderByCreatedAtDesc(UUID childId, AssignmentStatus status);

    List<TaskAssignment> findByChildIdInAndStatusInOrderByCompletedAtAsc(Collection<UUID> childIds,
                                                                        Collection<AssignmentStatus> statuses);

    long countByChildIdAndStatus(UUID childId, AssignmentStatus status);

    /**
     * 將逾期未完成的任務標記為過期。同時遞增 version，讓持有舊版本的寫入者失敗。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TaskAssignment a SET a.status = com.aiinpocket.choretrust.model.enums.AssignmentStatus.EXPIRED, " +
            "a.version = a.version + 1 " +
            "WHERE a.status IN :statuses AND a.dueDate IS NOT NULL AND a.dueDate < :now")
    int expireOverdue(@Param("statuses") Collection<AssignmentStatus> statuses, @Param("now") Instant now);
}
