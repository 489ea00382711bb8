package com.autotrader.backend.broker;

import lombok.Builder;
import lombok.Value;

/**
 * Order ticket. Modifying a working order means re-placing a copy with the same {@code orderId}.
 */
@Value
@Builder(toBuilder = true)
public class BrokerOrder {

    public static final String BUY = "BUY";
    public static final String SELL = "SELL";
    public static final String MARKET = "MKT";
    public static final String LIMIT = "LMT";
    public static final String STOP = "STP";

    int orderId;
    @Builder.Default
    int parentId = 0;
    String action;
    String orderType;
    double totalQuantity;
    Double lmtPrice;
    Double auxPrice;
    String ocaGroup;
    @Builder.Default
    int ocaType = 0;
    @Builder.Default
    boolean transmit = true;
    @Builder.Default
    String tif = "DAY";

    public boolean isSell() {
        return SELL.equalsIgnoreCase(action);
    }

    public boolean isBuy() {
        return BUY.equalsIgnoreCase(action);
    }

    public boolean hasType(String type) {
        return type.equalsIgnoreCase(orderType);
    }

    public boolean isStandalone() {
        return parentId == 0;
    }
}
