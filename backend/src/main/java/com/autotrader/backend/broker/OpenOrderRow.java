package com.autotrader.backend.broker;

public record OpenOrderRow(
        int orderId,
        String symbol,
        String exchange,
        String currency,
        String action,
        String orderType,
        double totalQty,
        double filled,
        double remaining,
        String status,
        Double lmtPrice,
        Double auxPrice
) {

    public static OpenOrderRow from(OpenTrade trade) {
        Contract c = trade.contract();
        BrokerOrder o = trade.order();
        return new OpenOrderRow(
                o.getOrderId(),
                c == null ? null : c.symbol(),
                c == null ? null : c.exchange(),
                c == null ? null : c.currency(),
                o.getAction(),
                o.getOrderType(),
                o.getTotalQuantity(),
                trade.filled(),
                trade.remaining(),
                trade.status(),
                o.getLmtPrice(),
                o.getAuxPrice()
        );
    }
}
