package com.autotrader.backend.service.decision;

import java.util.List;

public record BuySelection(List<String> selectedSymbols, String rationale) {

    public static BuySelection none(String rationale) {
        return new BuySelection(List.of(), rationale);
    }
}
