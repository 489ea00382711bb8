package com.autotrader.backend.controller;

import com.autotrader.backend.broker.AccountSummaryItem;
import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.OpenOrderRow;
import com.autotrader.backend.broker.PositionRow;
import com.autotrader.backend.model.AccountSummarySnapshot;
import com.autotrader.backend.model.EventLog;
import com.autotrader.backend.model.LiveStatus;
import com.autotrader.backend.model.OpenOrderSnapshot;
import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.model.PerformanceSnapshot;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.model.PositionSnapshot;
import com.autotrader.backend.model.ResearchLog;
import com.autotrader.backend.model.Trade;
import com.autotrader.backend.service.DashboardQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Dashboard")
public class DashboardController {

    private final DashboardQueryService queries;
    private final BrokerBridgeService bridge;

    @GetMapping("/health")
    @Operation(summary = "Process and broker connection health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("broker_state", bridge.getState().name());
        body.put("broker_connected", bridge.isConnected());
        body.put("account", bridge.getAccount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/live-status")
    @Operation(summary = "What the trading loop is doing right now")
    public ResponseEntity<LiveStatus> liveStatus() {
        return ResponseEntity.ok(queries.liveStatus());
    }

    @GetMapping("/events")
    @Operation(summary = "Most recent events, newest first")
    public ResponseEntity<List<EventLog>> events(@RequestParam(defaultValue = "200") int limit) {
        return ResponseEntity.ok(queries.events(limit));
    }

    @GetMapping("/research")
    @Operation(summary = "Most recent research records")
    public ResponseEntity<List<ResearchLog>> research(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queries.research(limit));
    }

    @GetMapping("/trades")
    @Operation(summary = "Most recent trade records")
    public ResponseEntity<List<Trade>> trades(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queries.trades(limit));
    }

    @GetMapping("/position-reviews")
    @Operation(summary = "Most recent position reviews")
    public ResponseEntity<List<PositionReview>> positionReviews(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queries.positionReviews(limit));
    }

    @GetMapping("/order-reviews")
    @Operation(summary = "Most recent order reviews")
    public ResponseEntity<List<OrderReview>> orderReviews(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queries.orderReviews(limit));
    }

    @GetMapping("/performance")
    @Operation(summary = "Account performance snapshots")
    public ResponseEntity<List<PerformanceSnapshot>> performance(@RequestParam(defaultValue = "500") int limit) {
        return ResponseEntity.ok(queries.performance(limit));
    }

    @GetMapping("/account-summary/latest")
    @Operation(summary = "Latest persisted account summary")
    public ResponseEntity<List<AccountSummarySnapshot>> latestAccountSummary() {
        return ResponseEntity.ok(queries.latestAccountSummary());
    }

    @GetMapping("/positions/latest")
    @Operation(summary = "Latest persisted positions snapshot")
    public ResponseEntity<List<PositionSnapshot>> latestPositions() {
        return ResponseEntity.ok(queries.latestPositions());
    }

    @GetMapping("/open-orders/latest")
    @Operation(summary = "Latest persisted open orders snapshot")
    public ResponseEntity<List<OpenOrderSnapshot>> latestOpenOrders() {
        return ResponseEntity.ok(queries.latestOpenOrders());
    }

    @GetMapping("/live/account-summary")
    @Operation(summary = "Account summary straight from the broker")
    public ResponseEntity<List<AccountSummaryItem>> liveAccountSummary() {
        return ResponseEntity.ok(bridge.await(bridge.getAccountSummary()));
    }

    @GetMapping("/live/positions")
    @Operation(summary = "Positions straight from the broker")
    public ResponseEntity<List<PositionRow>> livePositions() {
        return ResponseEntity.ok(bridge.await(bridge.getPositions()));
    }

    @GetMapping("/live/open-orders")
    @Operation(summary = "Open orders straight from the broker")
    public ResponseEntity<List<OpenOrderRow>> liveOpenOrders() {
        return ResponseEntity.ok(bridge.await(bridge.getOpenOrders()));
    }
}
