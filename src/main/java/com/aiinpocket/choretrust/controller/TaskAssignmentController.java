package com.aiinpocket.choretrust.controller;

import com.aiinpocket.choretrust.model.dto.ApprovalResult;
import com.aiinpocket.choretrust.model.dto.AssignmentView;
import com.aiinpocket.choretrust.model.dto.DeclineResult;
import com.aiinpocket.choretrust.model.dto.TaskRequests;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.service.ReviewAuthorityService;
import com.aiinpocket.choretrust.service.TaskVerificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * 任務流程 API。操作者身分由帳號系統放在 X-Actor-Id 標頭。
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskAssignmentController {

    static final String ACTOR = "X-Actor-Id";

    private final TaskVerificationService verificationService;
    private final ReviewAuthorityService authority;

    @PostMapping("/claim")
    @ResponseStatus(HttpStatus.CREATED)
    public AssignmentView claim(@RequestHeader(ACTOR) UUID actorId,
                                @Valid @RequestBody TaskRequests.Claim body) {
        return verificationService.claimTask(actorId, body.templateId(), body.level());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AssignmentView assign(@RequestHeader(ACTOR) UUID actorId,
                                 @Valid @RequestBody TaskRequests.Assign body) {
        return verificationService.assignTask(actorId, body.childId(), body.templateId(), body.level(), body.dueDate());
    }

    @GetMapping("/{id}")
    public AssignmentView get(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id) {
        AssignmentView view = verificationService.getAssignment(id);
        authority.requireSelfOrReviewer(actorId, view.childId());
        return view;
    }

    @GetMapping("/child/{childId}")
    public List<AssignmentView> childTasks(@RequestHeader(ACTOR) UUID actorId,
                                           @PathVariable UUID childId,
                                           @RequestParam(required = false) AssignmentStatus status) {
        authority.requireSelfOrReviewer(actorId, childId);
        return verificationService.getChildTasks(childId, status);
    }

    @GetMapping("/pending-reviews")
    public List<AssignmentView> pendingReviews(@RequestHeader(ACTOR) UUID actorId) {
        return verificationService.getPendingReviews(actorId);
    }

    @PatchMapping("/{id}")
    public AssignmentView edit(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id,
                               @Valid @RequestBody TaskRequests.Edit body) {
        return verificationService.editDetails(id, actorId, body.title(), body.description());
    }

    @PostMapping("/{id}/start")
    public AssignmentView start(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id) {
        return verificationService.start(id, actorId);
    }

    @PostMapping("/{id}/submit")
    public AssignmentView submit(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id,
                                 @Valid @RequestBody TaskRequests.Submit body) {
        return verificationService.submit(id, actorId, body.photoUrl(), body.notes(), body.completionTimeMinutes());
    }

    @PostMapping("/{id}/approve")
    public ApprovalResult approve(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id,
                                  @Valid @RequestBody(required = false) TaskRequests.Approve body) {
        TaskRequests.Approve req = body != null ? body : new TaskRequests.Approve(null, null);
        return verificationService.approve(id, actorId, req.adjustedLevel(), req.notes());
    }

    @PostMapping("/{id}/decline")
    public DeclineResult decline(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id,
                                 @Valid @RequestBody TaskRequests.Decline body) {
        return verificationService.decline(id, actorId, body.reason());
    }

    @PostMapping("/{id}/appeal")
    public AssignmentView appeal(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id,
                                 @Valid @RequestBody TaskRequests.Appeal body) {
        return verificationService.appeal(id, actorId, body.reason());
    }

    @PostMapping("/{id}/retract-decline")
    public AssignmentView retractDecline(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id) {
        return verificationService.retractDecline(id, actorId);
    }

    @PostMapping("/{id}/decline-viewed")
    public AssignmentView markDeclineViewed(@RequestHeader(ACTOR) UUID actorId, @PathVariable UUID id) {
        return verificationService.markDeclineViewed(id, actorId);
    }
}
