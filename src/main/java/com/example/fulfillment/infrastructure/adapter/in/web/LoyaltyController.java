package com.example.fulfillment.infrastructure.adapter.in.web;

import com.example.fulfillment.application.dto.LedgerEntryView;
import com.example.fulfillment.application.dto.LoyaltySummary;
import com.example.fulfillment.application.dto.RedemptionResult;
import com.example.fulfillment.application.port.in.LoyaltyQueryUseCase;
import com.example.fulfillment.application.port.in.RedeemPointsUseCase;
import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.RedeemPointsRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the loyalty ledger.
 */
@RestController
@RequestMapping("/api/loyalty")
@Tag(name = "Loyalty", description = "會員點數 API")
public class LoyaltyController {

    private final LoyaltyQueryUseCase queryUseCase;
    private final RedeemPointsUseCase redeemUseCase;
    private final OrderWebMapper mapper;

    public LoyaltyController(
            LoyaltyQueryUseCase queryUseCase,
            RedeemPointsUseCase redeemUseCase,
            OrderWebMapper mapper) {
        this.queryUseCase = queryUseCase;
        this.redeemUseCase = redeemUseCase;
        this.mapper = mapper;
    }

    @Operation(summary = "點數摘要", description = "餘額、累積經驗值、等級、會員階級與距離下一階級所需經驗值")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "404", description = "使用者不存在")
    })
    @GetMapping("/users/{userId}/summary")
    public ResponseEntity<LoyaltySummary> getSummary(
            @Parameter(description = "使用者 ID", required = true) @PathVariable Long userId) {
        return ResponseEntity.ok(queryUseCase.getSummary(userId));
    }

    @Operation(summary = "點數交易紀錄", description = "由新到舊排序")
    @GetMapping("/users/{userId}/transactions")
    public ResponseEntity<List<LedgerEntryView>> getTransactions(@PathVariable Long userId) {
        return ResponseEntity.ok(queryUseCase.getTransactions(userId));
    }

    @Operation(
            summary = "點數折抵",
            description = """
                    將點數兌換為折扣金額（點數 ÷ 兌換比例，四捨五入至小數兩位）。
                    檢查順序：功能啟用、點數為正、幣別支援、餘額足夠。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "折抵成功"),
            @ApiResponse(responseCode = "400", description = "折抵被拒絕，reason 欄位說明原因"),
            @ApiResponse(responseCode = "404", description = "使用者或訂單不存在")
    })
    @PostMapping("/redeem")
    public ResponseEntity<RedemptionResult> redeem(@Valid @RequestBody RedeemPointsRequest request) {
        return ResponseEntity.ok(redeemUseCase.redeemPoints(mapper.toCommand(request)));
    }

    @Operation(summary = "商品可得點數", description = "購買一件商品可獲得的點數，可選擇依使用者階級加乘")
    @GetMapping("/products/{productId}/points")
    public ResponseEntity<Map<String, Object>> getProductPoints(
            @PathVariable Long productId,
            @RequestParam(required = false) Long userId) {
        int points = queryUseCase.getProductPotentialPoints(productId, userId);
        return ResponseEntity.ok(Map.of("productId", productId, "points", points));
    }

    @Operation(summary = "會員階級列表", description = "依所需等級排序")
    @GetMapping("/tiers")
    public ResponseEntity<List<LoyaltyTier>> listTiers() {
        return ResponseEntity.ok(queryUseCase.listTiers());
    }
}
