package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.exception.ReviewAuthorityException;
import com.aiinpocket.choretrust.model.entity.GuardianLink;
import com.aiinpocket.choretrust.repository.GuardianLinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * 審核權限：只有與孩子有綁定關係的家長可以指派、審核或發放 XP。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewAuthorityService {

    private final GuardianLinkRepository linkRepo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean canReview(UUID guardianId, UUID childId) {
        return guardianId != null && linkRepo.existsByGuardianIdAndChildId(guardianId, childId);
    }

    /**
     * @throws ReviewAuthorityException 沒有審核權限
     */
    @Transactional(readOnly = true)
    public void requireReviewer(UUID guardianId, UUID childId) {
        if (!canReview(guardianId, childId)) {
            log.warn("[任務審核] {} 嘗試操作孩子 {} 的資料但沒有審核權限", guardianId, childId);
            throw new ReviewAuthorityException("沒有此孩子的審核權限");
        }
    }

    /**
     * 本人或有審核權限的家長才能查看孩子的資料。
     */
    @Transactional(readOnly = true)
    public void requireSelfOrReviewer(UUID actorId, UUID childId) {
        if (childId.equals(actorId)) {
            return;
        }
        requireReviewer(actorId, childId);
    }

    @Transactional(readOnly = true)
    public List<UUID> childrenOf(UUID guardianId) {
        return linkRepo.findChildIdsByGuardianId(guardianId);
    }

    /**
     * 建立家長與孩子的審核關係（由家庭帳號系統呼叫）。已存在時不重複建立。
     */
    @Transactional
    public void link(UUID guardianId, UUID childId) {
        if (linkRepo.existsByGuardianIdAndChildId(guardianId, childId)) {
            return;
        }
        linkRepo.save(GuardianLink.builder()
                .guardianId(guardianId)
                .childId(childId)
                .createdAt(clock.instant())
                .build());
        log.info("[任務審核] 建立審核關係：家長 {} → 孩子 {}", guardianId, childId);
    }
}
