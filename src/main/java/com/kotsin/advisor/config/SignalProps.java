package com.kotsin.advisor.config;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.VenueKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "signals")
public record SignalProps(
        @DefaultValue Monitor monitor,
        @DefaultValue Store store,
        @DefaultValue Feed feed,
        @DefaultValue Autogen autogen,
        @DefaultValue Catchup catchup,
        @DefaultValue Universe universe
) {

    public record Monitor(
            @DefaultValue("3s") Duration interval,
            @DefaultValue("8") int parallelism,
            @DefaultValue("100") int cleanupEveryTicks,
            @DefaultValue("false") boolean autoStart
    ) {
    }

    public record Store(
            @DefaultValue("redis") String type,
            @DefaultValue("24h") Duration maxAge,
            @DefaultValue("5") int maxWriteAttempts
    ) {
    }

    public record Feed(
            @DefaultValue("binance") String provider,
            @DefaultValue("3s") Duration timeout,
            @DefaultValue("https://api.binance.com") String binanceBaseUrl,
            @DefaultValue("100") int historyPoints
    ) {
    }

    public record Autogen(
            @DefaultValue("10m") Duration standardInterval,
            @DefaultValue("5m") Duration fastInterval,
            @DefaultValue("15m") Duration flowInterval,
            @DefaultValue("30") int fastSampleSize,
            @DefaultValue("true") boolean resumeOnStartup,
            @DefaultValue("CRYPTO") VenueKind defaultVenue,
            @DefaultValue("FUTURE") MarketKind defaultMarketKind
    ) {
    }

    public record Catchup(
            @DefaultValue("true") boolean onStartup
    ) {
    }

    public record Universe(
            @DefaultValue({"BTC/USDT", "ETH/USDT", "BNB/USDT", "SOL/USDT", "XRP/USDT", "ADA/USDT", "DOGE/USDT", "AVAX/USDT", "DOT/USDT", "LINK/USDT"})
            List<String> crypto,
            @DefaultValue({"EUR/USD", "GBP/USD", "USD/JPY", "AUD/USD", "USD/CAD", "XAU/USD"})
            List<String> forex,
            @DefaultValue({"BTC/USDT", "ETH/USDT"})
            List<String> flow
    ) {
    }
}
