package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.trading.Candidate;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RedditTickerSourceTest {

    private static final String LISTING = """
            {"data": {"children": [
              {"data": {"title": "$GME to the moon", "selftext": "still holding $gme"}},
              {"data": {"title": "$AMC and $GME", "selftext": ""}},
              {"data": {"title": "thoughts on $BB?", "selftext": "no cashtag here"}}
            ]}}
            """;

    @Test
    void mentionsAreRankedMostFrequentFirst() {
        Map<String, Integer> ranked = RedditTickerSource.rankMentions(List.of(
                "$TSLA and $aapl", "$AAPL again", "plain AAPL does not count", "$TOOLONG"));

        assertThat(ranked).containsExactly(Map.entry("AAPL", 2), Map.entry("TSLA", 1));
    }

    @Test
    void candidatesSkipKnownSymbolsAndReuseTheHourlyCache() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://www.reddit.com/r/stocks/new.json?limit=50"))
                .andExpect(header("User-Agent", "AutoTrader/1.0"))
                .andRespond(withSuccess(LISTING, MediaType.APPLICATION_JSON));

        BrokerBridgeService bridge = mock(BrokerBridgeService.class);
        when(bridge.await(any())).thenReturn(Optional.of(new Contract(7, "X", "STK", "SMART", "NYSE", "USD", "NMS")));
        RedditTickerSource source = new RedditTickerSource(restTemplate, bridge);

        TraderProperties config = new TraderProperties();
        config.getReddit().setSubreddits(List.of("stocks"));

        List<Candidate> first = source.candidates(config, Set.of("AMC"), Set.of());
        List<Candidate> second = source.candidates(config, Set.of(), Set.of("BB"));

        assertThat(first).extracting(Candidate::symbol).containsExactly("GME", "BB");
        assertThat(first).extracting(Candidate::scanSource).containsOnly("Reddit");
        assertThat(second).extracting(Candidate::symbol).containsExactly("GME", "AMC");
        server.verify();
    }

    @Test
    void microcapListingsAreDropped() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://www.reddit.com/r/stocks/new.json?limit=50"))
                .andRespond(withSuccess(LISTING, MediaType.APPLICATION_JSON));

        BrokerBridgeService bridge = mock(BrokerBridgeService.class);
        when(bridge.await(any())).thenReturn(Optional.of(new Contract(7, "X", "STK", "SMART", "PINK", "USD", "SCM")));
        RedditTickerSource source = new RedditTickerSource(restTemplate, bridge);

        TraderProperties config = new TraderProperties();
        config.getReddit().setSubreddits(List.of("stocks"));

        assertThat(source.candidates(config, Set.of(), Set.of())).isEmpty();
    }
}
