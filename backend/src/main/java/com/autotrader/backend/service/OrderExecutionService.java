package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.ContractDetails;
import com.autotrader.backend.broker.OpenTrade;
import com.autotrader.backend.broker.PositionRow;
import com.autotrader.backend.util.PriceTicks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Order placement and maintenance on top of the broker bridge. Long-only: exits are SELL orders and any
 * short that appears is treated as an error to unwind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderExecutionService {

    public static final int OCA_CANCEL_WITH_BLOCK = 1;

    private final BrokerBridgeService bridge;
    private final Map<String, Double> minTickCache = new ConcurrentHashMap<>();

    public record OrdersSummary(Double stopLoss, Integer stopOrderId, Double takeProfit, Integer takeProfitOrderId) {
    }

    public record PendingSellOrder(int orderId, String orderType, double quantity, String status) {
    }

    public record ClosedShort(String symbol, int quantity) {
    }

    public record OrderForReview(
            int orderId,
            Contract contract,
            String action,
            String orderType,
            int quantity,
            Double orderPrice,
            String status,
            int filled,
            int remaining,
            int ageMinutes,
            int parentId
    ) {
        public String symbol() {
            return contract == null ? null : contract.symbol();
        }
    }

    private enum ExitLeg {
        STOP_LOSS(BrokerOrder.STOP, "stop-loss") {
            @Override
            double round(double price, double tick) {
                return PriceTicks.roundDown(price, tick);
            }

            @Override
            BrokerOrder.BrokerOrderBuilder withPrice(BrokerOrder.BrokerOrderBuilder builder, double price) {
                return builder.auxPrice(price);
            }

            @Override
            ExitLeg counterpart() {
                return TAKE_PROFIT;
            }
        },
        TAKE_PROFIT(BrokerOrder.LIMIT, "take-profit") {
            @Override
            double round(double price, double tick) {
                return PriceTicks.roundUp(price, tick);
            }

            @Override
            BrokerOrder.BrokerOrderBuilder withPrice(BrokerOrder.BrokerOrderBuilder builder, double price) {
                return builder.lmtPrice(price);
            }

            @Override
            ExitLeg counterpart() {
                return STOP_LOSS;
            }
        };

        private final String orderType;
        private final String label;

        ExitLeg(String orderType, String label) {
            this.orderType = orderType;
            this.label = label;
        }

        abstract double round(double price, double tick);

        abstract BrokerOrder.BrokerOrderBuilder withPrice(BrokerOrder.BrokerOrderBuilder builder, double price);

        abstract ExitLeg counterpart();

        boolean matches(OpenTrade trade) {
            return trade.order().isSell() && trade.order().hasType(orderType);
        }
    }

    public List<OpenTrade> openTrades() {
        return bridge.await(bridge.getOpenTrades());
    }

    public List<OpenTrade> openTradesForSymbol(String symbol) {
        return openTrades().stream()
                .filter(t -> Objects.equals(t.symbol(), symbol))
                .toList();
    }

    public int cancelOrdersForSymbol(String symbol) {
        int cancelled = 0;
        for (OpenTrade trade : openTradesForSymbol(symbol)) {
            if (tryCancel(trade, "order")) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int positionQuantity(String symbol) {
        for (PositionRow row : bridge.await(bridge.getPositions())) {
            if (Objects.equals(row.symbol(), symbol)) {
                return (int) row.quantity();
            }
        }
        return 0;
    }

    /**
     * Market sell capped at the long quantity actually held. Returns null when nothing can be sold.
     */
    public OpenTrade sellPosition(Contract contract, int quantity) {
        if (quantity <= 0) {
            log.warn("Invalid sell quantity {} for {}", quantity, contract.symbol());
            return null;
        }
        int actual = positionQuantity(contract.symbol());
        if (actual <= 0) {
            log.warn("Cannot sell {}: no long position held (qty: {})", contract.symbol(), actual);
            return null;
        }
        int safeQuantity = Math.min(quantity, actual);
        if (safeQuantity < quantity) {
            log.warn("Capping sell quantity for {} from {} to {} (actual position)", contract.symbol(), quantity, safeQuantity);
        }
        cancelOrdersForSymbol(contract.symbol());
        OpenTrade trade = placeMarketOrder(contract, BrokerOrder.SELL, safeQuantity);
        log.info("Placed MARKET SELL for {} shares of {}", safeQuantity, contract.symbol());
        return trade;
    }

    public OpenTrade closeShortPosition(String symbol, String exchange, String currency) {
        int quantity = positionQuantity(symbol);
        if (quantity >= 0) {
            log.warn("Cannot close short for {}: not a short position (qty: {})", symbol, quantity);
            return null;
        }
        Contract contract = bridge.await(bridge.qualifyContract(Contract.stock(symbol, exchange, currency)))
                .orElse(Contract.stock(symbol, exchange, currency));
        cancelOrdersForSymbol(symbol);
        OpenTrade trade = placeMarketOrder(contract, BrokerOrder.BUY, Math.abs(quantity));
        log.info("Placed BUY TO COVER for {} shares of {}", Math.abs(quantity), symbol);
        return trade;
    }

    public List<ClosedShort> closeAllShorts() {
        List<ClosedShort> closed = new ArrayList<>();
        for (PositionRow row : bridge.await(bridge.getPositions())) {
            int quantity = (int) row.quantity();
            if (quantity >= 0) {
                continue;
            }
            log.warn("Found short position {} qty={}, closing", row.symbol(), quantity);
            String exchange = row.exchange() == null || row.exchange().isBlank() ? "SMART" : row.exchange();
            String currency = row.currency() == null ? "USD" : row.currency();
            if (closeShortPosition(row.symbol(), exchange, currency) != null) {
                closed.add(new ClosedShort(row.symbol(), Math.abs(quantity)));
            }
        }
        return closed;
    }

    /**
     * Cancels SELL orders for symbols with no long position; a fill would open a short.
     */
    public int cancelOrphanedSellOrders() {
        Set<String> longSymbols = new HashSet<>();
        for (PositionRow row : bridge.await(bridge.getPositions())) {
            if (row.quantity() > 0) {
                longSymbols.add(row.symbol());
            }
        }
        int cancelled = 0;
        for (OpenTrade trade : openTrades()) {
            String symbol = trade.symbol();
            if (trade.order().isSell() && symbol != null && !longSymbols.contains(symbol)) {
                log.warn("Cancelling orphaned SELL order {} for {} (no long position)", trade.order().getOrderId(), symbol);
                if (tryCancel(trade, "orphaned SELL")) {
                    cancelled++;
                }
            }
        }
        return cancelled;
    }

    public boolean upsertStopLoss(Contract contract, double stopPrice, Integer quantity) {
        return upsertExit(contract, stopPrice, quantity, ExitLeg.STOP_LOSS);
    }

    public boolean upsertTakeProfit(Contract contract, double takeProfitPrice, Integer quantity) {
        return upsertExit(contract, takeProfitPrice, quantity, ExitLeg.TAKE_PROFIT);
    }

    private boolean upsertExit(Contract contract, double requestedPrice, Integer quantity, ExitLeg leg) {
        String symbol = contract.symbol();
        if (symbol == null || symbol.isBlank()) {
            log.warn("Cannot upsert {}: contract has no symbol", leg.label);
            return false;
        }
        double price = requestedPrice;
        Double tick = minTick(contract);
        if (tick != null) {
            double rounded = leg.round(price, tick);
            if (rounded != price) {
                log.info("Rounded {} for {} to tick: {} -> {} (minTick={})", leg.label, symbol, price, rounded, tick);
            }
            price = rounded;
        }

        List<OpenTrade> trades = openTradesForSymbol(symbol);
        List<OpenTrade> existing = trades.stream().filter(leg::matches).toList();
        List<OpenTrade> counterparts = trades.stream().filter(leg.counterpart()::matches).toList();
        boolean link = !counterparts.isEmpty();
        String ocaGroup = "OCA_EXIT_" + symbol;

        Contract target;
        BrokerOrder order;
        if (!existing.isEmpty()) {
            OpenTrade current = existing.get(0);
            BrokerOrder.BrokerOrderBuilder builder = leg.withPrice(current.order().toBuilder(), price);
            if (link) {
                builder.ocaGroup(ocaGroup).ocaType(OCA_CANCEL_WITH_BLOCK);
            }
            target = current.contract();
            order = builder.build();
        } else {
            int qty = quantity != null ? quantity : positionQuantity(symbol);
            if (qty <= 0) {
                log.warn("Cannot create {} for {}: no long position quantity available", leg.label, symbol);
                return false;
            }
            BrokerOrder.BrokerOrderBuilder builder = BrokerOrder.builder()
                    .orderId(bridge.await(bridge.nextOrderId()))
                    .action(BrokerOrder.SELL)
                    .orderType(leg.orderType)
                    .totalQuantity(qty)
                    .transmit(true);
            leg.withPrice(builder, price);
            if (link) {
                builder.ocaGroup(ocaGroup).ocaType(OCA_CANCEL_WITH_BLOCK);
            }
            target = contract;
            order = builder.build();
        }

        if (link) {
            for (OpenTrade extra : counterparts.subList(1, counterparts.size())) {
                tryCancel(extra, "extra " + leg.counterpart().label);
            }
            OpenTrade counterpart = counterparts.get(0);
            bridge.await(bridge.placeOrder(counterpart.contract(), counterpart.order().toBuilder()
                    .ocaGroup(ocaGroup)
                    .ocaType(OCA_CANCEL_WITH_BLOCK)
                    .build()));
        }

        bridge.await(bridge.placeOrder(target, order));
        if (existing.isEmpty()) {
            log.info("Placed {} for {}: {} (qty={})", leg.label, symbol, price, order.getTotalQuantity());
        } else {
            log.info("Modified {} for {} -> {}", leg.label, symbol, price);
            for (OpenTrade extra : existing.subList(1, existing.size())) {
                tryCancel(extra, "extra " + leg.label);
            }
        }
        return true;
    }

    public OrdersSummary ordersSummary(String symbol) {
        Double stopLoss = null;
        Integer stopOrderId = null;
        Double takeProfit = null;
        Integer takeProfitOrderId = null;
        for (OpenTrade trade : openTradesForSymbol(symbol)) {
            BrokerOrder order = trade.order();
            if (ExitLeg.STOP_LOSS.matches(trade)) {
                stopLoss = order.getAuxPrice();
                stopOrderId = order.getOrderId();
            } else if (ExitLeg.TAKE_PROFIT.matches(trade)) {
                takeProfit = order.getLmtPrice();
                takeProfitOrderId = order.getOrderId();
            }
        }
        return new OrdersSummary(stopLoss, stopOrderId, takeProfit, takeProfitOrderId);
    }

    public List<PendingSellOrder> pendingSellOrders(String symbol) {
        return openTradesForSymbol(symbol).stream()
                .filter(t -> t.order().isSell())
                .map(t -> new PendingSellOrder(t.order().getOrderId(), t.order().getOrderType(),
                        t.order().getTotalQuantity(), t.status()))
                .toList();
    }

    /**
     * Market BUY transmitted straight away, with SELL LMT / SELL STP children attached by parent id in one
     * OCA group. Children stay inactive until the parent fills.
     */
    public OpenTrade executeBuyOrder(Contract contract, int quantity, Double stopLoss, Double takeProfit) {
        if (quantity <= 0) {
            log.warn("Invalid quantity {} for {}", quantity, contract.symbol());
            return null;
        }
        if (stopLoss == null && takeProfit == null) {
            OpenTrade trade = placeMarketOrder(contract, BrokerOrder.BUY, quantity);
            log.info("Placed BUY for {} shares of {}", quantity, contract.symbol());
            return trade;
        }

        Double tick = minTick(contract);
        int parentId = bridge.await(bridge.nextOrderId());
        String ocaGroup = "OCA_" + parentId;
        BrokerOrder parent = BrokerOrder.builder()
                .orderId(parentId)
                .action(BrokerOrder.BUY)
                .orderType(BrokerOrder.MARKET)
                .totalQuantity(quantity)
                .transmit(true)
                .build();

        List<BrokerOrder> children = new ArrayList<>();
        if (takeProfit != null) {
            double price = tick == null ? takeProfit : PriceTicks.roundUp(takeProfit, tick);
            children.add(BrokerOrder.builder()
                    .orderId(bridge.await(bridge.nextOrderId()))
                    .parentId(parentId)
                    .action(BrokerOrder.SELL)
                    .orderType(BrokerOrder.LIMIT)
                    .totalQuantity(quantity)
                    .lmtPrice(price)
                    .ocaGroup(ocaGroup)
                    .ocaType(OCA_CANCEL_WITH_BLOCK)
                    .transmit(true)
                    .build());
        }
        if (stopLoss != null) {
            double price = tick == null ? stopLoss : PriceTicks.roundDown(stopLoss, tick);
            children.add(BrokerOrder.builder()
                    .orderId(bridge.await(bridge.nextOrderId()))
                    .parentId(parentId)
                    .action(BrokerOrder.SELL)
                    .orderType(BrokerOrder.STOP)
                    .totalQuantity(quantity)
                    .auxPrice(price)
                    .ocaGroup(ocaGroup)
                    .ocaType(OCA_CANCEL_WITH_BLOCK)
                    .transmit(true)
                    .build());
        }

        OpenTrade trade = bridge.await(bridge.placeOrder(contract, parent));
        log.info("Placed BUY (parent) for {} shares of {} (orderId={})", quantity, contract.symbol(), parentId);
        for (BrokerOrder child : children) {
            bridge.await(bridge.placeOrder(contract, child));
            log.info("Attached {} {} at {} for {}", child.getOrderType(), child.getAction(),
                    child.hasType(BrokerOrder.LIMIT) ? child.getLmtPrice() : child.getAuxPrice(), contract.symbol());
        }
        return trade;
    }

    public boolean cancelOrder(int orderId) {
        for (OpenTrade trade : openTrades()) {
            if (trade.order().getOrderId() == orderId) {
                return tryCancel(trade, "order");
            }
        }
        log.warn("Order {} not found in open trades", orderId);
        return false;
    }

    /**
     * LMT orders move their limit price, STP orders their stop trigger. Other types are refused.
     */
    public boolean adjustOrderPrice(int orderId, double newPrice) {
        for (OpenTrade trade : openTrades()) {
            BrokerOrder order = trade.order();
            if (order.getOrderId() != orderId) {
                continue;
            }
            BrokerOrder adjusted;
            if (order.hasType(BrokerOrder.LIMIT)) {
                adjusted = order.toBuilder().lmtPrice(newPrice).build();
            } else if (order.hasType(BrokerOrder.STOP)) {
                adjusted = order.toBuilder().auxPrice(newPrice).build();
            } else {
                log.warn("Cannot adjust price for order type {}", order.getOrderType());
                return false;
            }
            try {
                bridge.await(bridge.placeOrder(trade.contract(), adjusted));
                log.info("Adjusted order {} price -> {}", orderId, newPrice);
                return true;
            } catch (RuntimeException e) {
                log.warn("Failed to adjust order {}: {}", orderId, e.getMessage());
                return false;
            }
        }
        log.warn("Order {} not found in open trades", orderId);
        return false;
    }

    public List<OrderForReview> openOrdersForReview() {
        Instant now = Instant.now();
        List<OrderForReview> result = new ArrayList<>();
        for (OpenTrade trade : openTrades()) {
            BrokerOrder order = trade.order();
            Double orderPrice = null;
            if (order.hasType(BrokerOrder.LIMIT)) {
                orderPrice = order.getLmtPrice();
            } else if (order.hasType(BrokerOrder.STOP)) {
                orderPrice = order.getAuxPrice();
            }
            int ageMinutes = trade.createdAt() == null ? 0 : (int) Duration.between(trade.createdAt(), now).toMinutes();
            result.add(new OrderForReview(
                    order.getOrderId(),
                    trade.contract(),
                    order.getAction(),
                    order.getOrderType(),
                    (int) order.getTotalQuantity(),
                    orderPrice,
                    trade.status(),
                    (int) trade.filled(),
                    (int) trade.remaining(),
                    ageMinutes,
                    order.getParentId()
            ));
        }
        return result;
    }

    /**
     * Best-effort minimum tick lookup, cached per instrument.
     */
    public Double minTick(Contract contract) {
        String key = contract.cacheKey();
        Double cached = minTickCache.get(key);
        if (cached != null) {
            return cached;
        }
        try {
            List<ContractDetails> details = bridge.await(bridge.getContractDetails(contract));
            if (!details.isEmpty() && details.get(0).minTick() > 0) {
                double tick = details.get(0).minTick();
                minTickCache.put(key, tick);
                return tick;
            }
        } catch (RuntimeException e) {
            log.debug("Failed to fetch contract details for minTick of {}: {}", contract.symbol(), e.getMessage());
        }
        return null;
    }

    public OpenTrade placeMarketOrder(Contract contract, String action, int quantity) {
        BrokerOrder order = BrokerOrder.builder()
                .orderId(bridge.await(bridge.nextOrderId()))
                .action(action)
                .orderType(BrokerOrder.MARKET)
                .totalQuantity(quantity)
                .transmit(true)
                .build();
        return bridge.await(bridge.placeOrder(contract, order));
    }

    private boolean tryCancel(OpenTrade trade, String what) {
        try {
            bridge.await(bridge.cancelOrder(trade.order()));
            log.info("Cancelled {} {} for {}", what, trade.order().getOrderId(), trade.symbol());
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to cancel {} {} for {}: {}", what, trade.order().getOrderId(), trade.symbol(), e.getMessage());
            return false;
        }
    }
}
