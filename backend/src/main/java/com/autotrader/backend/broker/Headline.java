package com.autotrader.backend.broker;

import java.time.Instant;

public record Headline(Instant time, String providerCode, String articleId, String headline) {
}
