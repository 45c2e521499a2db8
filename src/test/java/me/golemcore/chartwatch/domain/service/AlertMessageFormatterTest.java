package me.golemcore.chartwatch.domain.service;

import me.golemcore.chartwatch.domain.model.AnalysisResult;
import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.SignalAction;
import me.golemcore.chartwatch.domain.model.TradeSetup;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertMessageFormatterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:00Z");

    private ChartWatchProperties properties;
    private AlertMessageFormatter formatter;

    @BeforeEach
    void setUp() {
        properties = new ChartWatchProperties();
        properties.getTelegram().setAppBaseUrl("https://charts.example.com/");
        formatter = new AlertMessageFormatter(properties);
    }

    @Test
    void shouldRenderTradingAlert() {
        AutomationSchedule schedule = AutomationSchedule.builder()
                .id("sched-1")
                .targetRef("layout-1")
                .targetLabel("BTCUSD 4h")
                .build();
        AnalysisResult result = AnalysisResult.builder()
                .action(SignalAction.BUY)
                .confidence(82)
                .analysisId("an-42")
                .timeframe("4h")
                .reasons(List.of("Breakout above resistance"))
                .build();

        String message = formatter.formatTradingAlert(schedule, result, NOW);

        assertTrue(message.contains("<b>BTCUSD 4h</b>"));
        assertTrue(message.contains("📈 BUY"));
        assertTrue(message.contains("82% 🟢🟢⚪"));
        assertTrue(message.contains("<b>Timeframe:</b> 4h"));
        assertTrue(message.contains("Breakout above resistance"));
        assertTrue(message.contains("2026-03-01 10:15 UTC"));
        assertTrue(message.contains("href=\"https://charts.example.com/analysis/an-42\""));
    }

    @Test
    void shouldRenderTradeSetupForDirectionalSignal() {
        AnalysisResult result = setupResult(SignalAction.SELL, TradeSetup.builder()
                .quality("A")
                .entryPrice(2350.5)
                .stopLoss(2370.5)
                .targetPrice(2310.5)
                .reasons(List.of("Double top", "Bearish divergence", "Below VWAP", "Volume fading"))
                .build());

        String message = formatter.formatTradingAlert(labelledSchedule(), result, NOW);

        assertTrue(message.contains("💼 <b>Trade Setup</b> (A)"));
        assertTrue(message.contains("Entry: <code>2350.50</code>"));
        assertTrue(message.contains("Stop Loss: <code>2370.50</code>"));
        assertTrue(message.contains("Target: <code>2310.50</code>"));
        assertTrue(message.contains("R:R Ratio: <code>1:2.00</code>"));
        assertTrue(message.contains("1. Double top\n2. Bearish divergence\n3. Below VWAP"));
        assertFalse(message.contains("Volume fading"));
    }

    @Test
    void shouldOmitTradeSetupForHoldOrIncompletePrices() {
        TradeSetup complete = TradeSetup.builder().quality("B").entryPrice(1.1).stopLoss(1.09).targetPrice(1.13)
                .build();
        TradeSetup noTarget = TradeSetup.builder().quality("B").entryPrice(1.1).stopLoss(1.09).build();

        String hold = formatter.formatTradingAlert(labelledSchedule(), setupResult(SignalAction.HOLD, complete), NOW);
        String incomplete = formatter.formatTradingAlert(labelledSchedule(),
                setupResult(SignalAction.BUY, noTarget), NOW);

        assertFalse(hold.contains("Trade Setup"));
        assertFalse(incomplete.contains("Trade Setup"));
    }

    @Test
    void shouldSkipRiskRewardWhenStopEqualsEntry() {
        TradeSetup flat = TradeSetup.builder().entryPrice(150.0).stopLoss(150.0).targetPrice(160.0).build();

        String message = formatter.formatTradingAlert(labelledSchedule(), setupResult(SignalAction.BUY, flat), NOW);

        assertTrue(message.contains("Entry: <code>150.000</code>"));
        assertFalse(message.contains("R:R Ratio"));
    }

    @Test
    void shouldFormatPriceByMagnitude() {
        assertEquals("1.08523", AlertMessageFormatter.formatPrice(1.085234));
        assertEquals("187.250", AlertMessageFormatter.formatPrice(187.25));
        assertEquals("2350.10", AlertMessageFormatter.formatPrice(2350.1));
        assertEquals("64250.00", AlertMessageFormatter.formatPrice(64250));
    }

    @Test
    void shouldRenderConnectionTestMessage() {
        String message = formatter.formatConnectionTest();

        assertTrue(message.startsWith("✅ <b>Telegram Connection Successful!</b>"));
        assertTrue(message.contains("Automation is now active!"));
    }

    @Test
    void shouldTruncateLongReasonAndEscapeHtml() {
        AutomationSchedule schedule = AutomationSchedule.builder().id("sched-1").targetRef("<layout>").build();
        String longReason = "x".repeat(200);
        AnalysisResult result = AnalysisResult.builder()
                .action(SignalAction.SELL)
                .confidence(40)
                .reasons(List.of(longReason))
                .build();

        String message = formatter.formatTradingAlert(schedule, result, NOW);

        assertTrue(message.contains("&lt;layout&gt;"));
        assertTrue(message.contains("x".repeat(150) + "..."));
        assertFalse(message.contains("x".repeat(151)));
        assertFalse(message.contains("View Full Analysis"));
    }

    @Test
    void shouldRenderErrorAlert() {
        AutomationSchedule schedule = AutomationSchedule.builder().id("sched-1").targetRef("layout-1").build();

        String message = formatter.formatErrorAlert(schedule, "timeout & retry", NOW);

        assertTrue(message.contains("Automation Error"));
        assertTrue(message.contains("layout-1"));
        assertTrue(message.contains("timeout &amp; retry"));
    }

    @Test
    void confidenceMeterShouldFollowBands() {
        assertEquals("🟢🟢🟢", AlertMessageFormatter.confidenceMeter(90));
        assertEquals("🟢🟢⚪", AlertMessageFormatter.confidenceMeter(70));
        assertEquals("🟢⚪⚪", AlertMessageFormatter.confidenceMeter(50));
        assertEquals("🟡⚪⚪", AlertMessageFormatter.confidenceMeter(30));
        assertEquals("🔴⚪⚪", AlertMessageFormatter.confidenceMeter(29));
    }

    @Test
    void actionLabelShouldIncludeEmoji() {
        assertEquals("⏸️ HOLD", AlertMessageFormatter.actionLabel(SignalAction.HOLD));
        assertEquals("📉 SELL", AlertMessageFormatter.actionLabel(SignalAction.SELL));
    }

    private static AutomationSchedule labelledSchedule() {
        return AutomationSchedule.builder().id("sched-1").targetRef("layout-1").targetLabel("XAUUSD 1h").build();
    }

    private static AnalysisResult setupResult(SignalAction action, TradeSetup setup) {
        return AnalysisResult.builder()
                .action(action)
                .confidence(75)
                .analysisId("an-7")
                .tradeSetup(setup)
                .build();
    }
}
