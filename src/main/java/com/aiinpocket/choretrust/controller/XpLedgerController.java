package com.aiinpocket.choretrust.controller;

import com.aiinpocket.choretrust.model.dto.DailyXpSummary;
import com.aiinpocket.choretrust.model.dto.RedemptionResult;
import com.aiinpocket.choretrust.model.dto.XpBalanceView;
import com.aiinpocket.choretrust.model.dto.XpRequests;
import com.aiinpocket.choretrust.model.dto.XpTransactionView;
import com.aiinpocket.choretrust.service.ReviewAuthorityService;
import com.aiinpocket.choretrust.service.XpLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/xp")
@RequiredArgsConstructor
public class XpLedgerController {

    private final XpLedgerService xpLedger;
    private final ReviewAuthorityService authority;

    @GetMapping("/balance")
    public XpBalanceView balance(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId) {
        return xpLedger.getBalance(actorId);
    }

    @GetMapping("/transactions")
    public List<XpTransactionView> transactions(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                                @RequestParam(defaultValue = "20") int limit) {
        return xpLedger.getRecentTransactions(actorId, limit);
    }

    @GetMapping("/daily-summary")
    public DailyXpSummary dailySummary(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId) {
        return xpLedger.getDailySummary(actorId);
    }

    @PostMapping("/redeem")
    public RedemptionResult redeem(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                   @Valid @RequestBody XpRequests.Redeem body) {
        return xpLedger.redeem(actorId, body.amount());
    }

    /** 家長手動發放 XP */
    @PostMapping("/grant")
    public Map<String, Integer> grant(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                      @Valid @RequestBody XpRequests.Grant body) {
        authority.requireReviewer(actorId, body.childId());
        int balance = xpLedger.grant(body.childId(), body.amount(), body.reason());
        return Map.of("currentXp", balance);
    }

    @PostMapping("/starter-bonus")
    public Map<String, Integer> starterBonus(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId) {
        int balance = xpLedger.grantStarterBonus(actorId);
        return Map.of("currentXp", balance);
    }
}
