package com.example.fulfillment.infrastructure.adapter.in.web;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.port.in.OrderLifecycleUseCase;
import com.example.fulfillment.application.port.in.PlaceOrderUseCase;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.AddItemRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.CancelOrderRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.HistoryEntryResponse;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.ItemQuantityRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.PlaceOrderRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.RefundResponse;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.StatusChangeRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.TrackingRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for order placement and lifecycle operations.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "訂單管理 API")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final PlaceOrderUseCase placeOrderUseCase;
    private final OrderLifecycleUseCase lifecycleUseCase;
    private final OrderWebMapper mapper;

    public OrderController(
            PlaceOrderUseCase placeOrderUseCase,
            OrderLifecycleUseCase lifecycleUseCase,
            OrderWebMapper mapper) {
        this.placeOrderUseCase = placeOrderUseCase;
        this.lifecycleUseCase = lifecycleUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "建立訂單",
            description = """
                    建立新訂單，流程包含：
                    1. **庫存保留** - 每個品項以原子化條件扣減保留庫存
                    2. **價格快照** - 以商品最終價格（含稅、折扣後）記錄單價
                    3. **點數折抵** - 若提供 loyaltyPointsToRedeem，於同一交易中扣點並折抵應付金額

                    任一品項庫存不足時整筆訂單失敗，不會保留任何庫存。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "訂單建立成功",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = OrderView.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "請求參數錯誤或點數折抵失敗",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "LOYALTY_VALIDATION",
                                      "reason": "INSUFFICIENT_BALANCE",
                                      "message": "Insufficient points balance. Available: 100, Requested: 500",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "409",
                    description = "庫存不足",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INSUFFICIENT_STOCK",
                                      "message": "Insufficient stock for product 7: requested 3, available 1",
                                      "productId": 7,
                                      "requested": 3,
                                      "available": 1,
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            )
    })
    @PostMapping
    public ResponseEntity<OrderView> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        log.info("Received order request with {} items for user {}", request.items().size(), request.userId());
        OrderView order = placeOrderUseCase.placeOrder(mapper.toCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }

    @Operation(summary = "查詢訂單", description = "根據訂單 ID 查詢訂單內容與狀態")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "404", description = "訂單不存在")
    })
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderView> getOrder(
            @Parameter(description = "訂單 ID", required = true)
            @PathVariable Long orderId) {
        return ResponseEntity.ok(lifecycleUseCase.getOrder(orderId));
    }

    @Operation(
            summary = "變更訂單狀態",
            description = """
                    依狀態機規則變更訂單狀態。要求目前狀態視為無動作。
                    進入 CANCELED 時歸還庫存；進入 COMPLETED / CANCELED / REFUNDED / RETURNED 時觸發點數任務。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "狀態已變更"),
            @ApiResponse(responseCode = "404", description = "訂單不存在"),
            @ApiResponse(
                    responseCode = "409",
                    description = "不允許的狀態轉換",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INVALID_TRANSITION",
                                      "message": "Cannot transition from PENDING to DELIVERED",
                                      "currentStatus": "PENDING",
                                      "requestedStatus": "DELIVERED",
                                      "allowed": ["CANCELED", "PROCESSING"],
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            )
    })
    @PostMapping("/{orderId}/status")
    public ResponseEntity<OrderView> changeStatus(
            @Parameter(description = "訂單 ID", required = true) @PathVariable Long orderId,
            @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(lifecycleUseCase.changeStatus(orderId, mapper.toStatus(request.status()), request.note()));
    }

    @Operation(summary = "取消訂單", description = "取消訂單並歸還所有未退款品項的庫存")
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderView> cancelOrder(
            @PathVariable Long orderId,
            @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(lifecycleUseCase.cancelOrder(orderId, reason));
    }

    @Operation(summary = "標記已付款", description = "付款完成；PENDING 訂單進入 PROCESSING")
    @PostMapping("/{orderId}/payment")
    public ResponseEntity<OrderView> markPaid(@PathVariable Long orderId) {
        return ResponseEntity.ok(lifecycleUseCase.markPaid(orderId));
    }

    @Operation(summary = "新增物流資訊", description = "記錄物流單號並將訂單推進至 SHIPPED")
    @PostMapping("/{orderId}/tracking")
    public ResponseEntity<OrderView> addTracking(
            @PathVariable Long orderId,
            @Valid @RequestBody TrackingRequest request) {
        return ResponseEntity.ok(lifecycleUseCase.addTrackingInfo(orderId, request.trackingNumber(), request.carrier()));
    }

    @Operation(summary = "新增品項", description = "於可編輯狀態（PENDING / PROCESSING）新增品項，需通過庫存檢查")
    @PostMapping("/{orderId}/items")
    public ResponseEntity<OrderView> addItem(
            @PathVariable Long orderId,
            @Valid @RequestBody AddItemRequest request) {
        return ResponseEntity.ok(lifecycleUseCase.addItem(orderId, request.productId(), request.quantity()));
    }

    @Operation(summary = "修改品項數量", description = "既有品項不做庫存檢查，僅依差額調整庫存")
    @PatchMapping("/{orderId}/items/{itemId}")
    public ResponseEntity<OrderView> updateItemQuantity(
            @PathVariable Long orderId,
            @PathVariable Long itemId,
            @Valid @RequestBody ItemQuantityRequest request) {
        return ResponseEntity.ok(lifecycleUseCase.updateItemQuantity(orderId, itemId, request.quantity()));
    }

    @Operation(summary = "品項退款", description = "部分或全部退款，並歸還對應庫存")
    @PostMapping("/{orderId}/items/{itemId}/refund")
    public ResponseEntity<RefundResponse> refundItem(
            @PathVariable Long orderId,
            @PathVariable Long itemId,
            @Valid @RequestBody ItemQuantityRequest request) {
        Money refunded = lifecycleUseCase.refundItem(orderId, itemId, request.quantity());
        return ResponseEntity.ok(mapper.toRefundResponse(orderId, itemId, request.quantity(), refunded));
    }

    @Operation(summary = "查詢訂單歷程", description = "依時間排序的狀態變更、退款與備註紀錄")
    @GetMapping("/{orderId}/history")
    public ResponseEntity<List<HistoryEntryResponse>> getHistory(@PathVariable Long orderId) {
        List<HistoryEntryResponse> history = lifecycleUseCase.getHistory(orderId).stream()
                .map(mapper::toResponse)
                .toList();
        return ResponseEntity.ok(history);
    }

    @Operation(summary = "刪除訂單", description = "軟刪除，訂單與歷程仍保留於資料庫")
    @DeleteMapping("/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable Long orderId) {
        lifecycleUseCase.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }
}
