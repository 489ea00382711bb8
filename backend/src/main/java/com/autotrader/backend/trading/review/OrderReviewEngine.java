package com.autotrader.backend.trading.review;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Quote;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.ReviewLogService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.OrderReviewDecision;
import com.autotrader.backend.trading.MarketContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reviews standalone working orders. Bracket children (non-zero parent id) are never reviewed; their
 * parent decides their fate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderReviewEngine {

    private final BrokerBridgeService bridge;
    private final OrderExecutionService orderExecution;
    private final DecisionService decisionService;
    private final ReviewLogService reviewLogService;
    private final EventStreamService events;

    public List<OrderReview> reviewAll(TraderProperties config, MarketContext marketContext, int minAgeMinutes) {
        List<OrderExecutionService.OrderForReview> toReview = selectForReview(orderExecution.openOrdersForReview(),
                minAgeMinutes);
        if (toReview.isEmpty()) {
            log.debug("No open orders to review");
            return List.of();
        }

        events.updateLiveStatus("Order Manager", "Reviewing " + toReview.size() + " open orders");
        events.info("OM", "Start", "Reviewing " + toReview.size() + " open orders");
        List<OrderReview> reviews = new ArrayList<>();
        for (OrderExecutionService.OrderForReview order : toReview) {
            try {
                reviews.add(review(config, order, marketContext));
            } catch (RuntimeException e) {
                log.error("Error reviewing order {}", order.orderId(), e);
                events.error(order.symbol(), "OM", "Order review failed: " + e.getMessage());
            }
        }
        events.updateLiveStatus("Order Manager",
                "Reviewed " + toReview.size() + " orders, " + reviews.size() + " decisions");
        return reviews;
    }

    static List<OrderExecutionService.OrderForReview> selectForReview(List<OrderExecutionService.OrderForReview> orders,
                                                                      int minAgeMinutes) {
        return orders.stream()
                .filter(o -> o.parentId() == 0)
                .filter(o -> o.ageMinutes() >= minAgeMinutes)
                .toList();
    }

    OrderReview review(TraderProperties config, OrderExecutionService.OrderForReview order, MarketContext marketContext) {
        String symbol = order.symbol();
        Quote quote = Quote.empty();
        if (order.contract() != null) {
            try {
                quote = bridge.await(bridge.getQuote(order.contract()));
            } catch (RuntimeException e) {
                log.warn("Cannot get current price for order {} ({}); continuing without market price",
                        order.orderId(), symbol);
            }
        }
        Double currentPrice = quote.price();
        Double bid = Quote.isUsable(quote.bid()) ? quote.bid() : null;
        Double ask = Quote.isUsable(quote.ask()) ? quote.ask() : null;
        Double distancePct = null;
        if (order.orderPrice() != null && currentPrice != null && currentPrice > 0) {
            distancePct = (order.orderPrice() - currentPrice) / currentPrice * 100.0;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", symbol);
        payload.put("order_id", order.orderId());
        payload.put("order_action", order.action());
        payload.put("order_type", order.orderType());
        payload.put("order_quantity", order.quantity());
        payload.put("order_price", order.orderPrice());
        payload.put("order_status", order.status());
        payload.put("current_price", currentPrice);
        payload.put("bid", bid);
        payload.put("ask", ask);
        payload.put("price_distance_pct", distancePct);
        payload.put("order_age_minutes", order.ageMinutes());
        payload.put("market_context", marketContext == null ? null : marketContext.toPayload());

        OrderReview.OrderReviewBuilder record = OrderReview.builder()
                .createdAt(Instant.now())
                .orderId((long) order.orderId())
                .symbol(symbol)
                .orderType(order.orderType())
                .orderAction(order.action())
                .orderQuantity(order.quantity())
                .orderPrice(order.orderPrice())
                .currentPrice(currentPrice)
                .bidPrice(bid)
                .askPrice(ask)
                .priceDistancePct(distancePct)
                .orderAgeMinutes(order.ageMinutes());

        events.info(symbol, "OM-AI", "AI reviewing order " + order.orderId() + " (" + order.action() + " "
                + order.orderType() + ")");
        OrderReviewDecision decision;
        try {
            decision = decisionService.reviewOrder(config, payload);
        } catch (RuntimeException e) {
            String failure = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("AI order review failed for {} order {}: {}", symbol, order.orderId(), failure);
            events.error(symbol, "OM-AI", "AI order review failed: " + failure);
            OrderReview failed = record.action(PositionReviewEngine.ACTION_ERROR).rationale(failure).executed(false).build();
            reviewLogService.recordOrderReview(failed);
            return failed;
        }

        boolean executed = execute(order, decision);
        OrderReview review = record
                .action(decision.action())
                .newPrice(decision.newPrice())
                .confidence(decision.confidence())
                .rationale(decision.rationale())
                .executed(executed)
                .build();
        reviewLogService.recordOrderReview(review);
        return review;
    }

    private boolean execute(OrderExecutionService.OrderForReview order, OrderReviewDecision decision) {
        String symbol = order.symbol();
        int orderId = order.orderId();
        switch (decision.action()) {
            case OrderReviewDecision.KEEP -> {
                events.info(symbol, "OM-Keep", String.format(Locale.ROOT, "AI: KEEP order %d (conf %.2f) - %s",
                        orderId, decision.confidence(), decision.rationale()));
                return false;
            }
            case OrderReviewDecision.CANCEL -> {
                events.info(symbol, "OM-Cancel", String.format(Locale.ROOT, "AI: CANCEL order %d (conf %.2f) - %s",
                        orderId, decision.confidence(), decision.rationale()));
                try {
                    boolean cancelled = orderExecution.cancelOrder(orderId);
                    if (cancelled) {
                        events.info(symbol, "OM-Cancel", "Cancelled order " + orderId);
                    }
                    return cancelled;
                } catch (RuntimeException e) {
                    events.error(symbol, "OM-Cancel", "Cancel order failed: " + e.getMessage());
                    return false;
                }
            }
            case OrderReviewDecision.ADJUST_PRICE -> {
                Double newPrice = decision.newPrice();
                if (newPrice == null || newPrice <= 0) {
                    events.warn(symbol, "OM-Adjust", "AI: ADJUST_PRICE invalid new_price=" + newPrice);
                    return false;
                }
                events.info(symbol, "OM-Adjust", String.format(Locale.ROOT, "AI: ADJUST_PRICE order %d to %.2f (conf %.2f)",
                        orderId, newPrice, decision.confidence()));
                try {
                    return orderExecution.adjustOrderPrice(orderId, newPrice);
                } catch (RuntimeException e) {
                    events.error(symbol, "OM-Adjust", "Adjust order price failed: " + e.getMessage());
                    return false;
                }
            }
            default -> {
                log.warn("Unhandled order review action {} for order {}", decision.action(), orderId);
                return false;
            }
        }
    }
}
