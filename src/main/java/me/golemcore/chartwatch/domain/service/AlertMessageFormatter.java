package me.golemcore.chartwatch.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chartwatch.domain.model.AnalysisResult;
import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.SignalAction;
import me.golemcore.chartwatch.domain.model.TradeSetup;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders automation alerts as Telegram HTML.
 */
@Component
@RequiredArgsConstructor
public class AlertMessageFormatter {

    private static final int MAX_REASON_LENGTH = 150;
    private static final int MAX_KEY_REASONS = 3;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm 'UTC'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final ChartWatchProperties properties;

    public String formatTradingAlert(AutomationSchedule schedule, AnalysisResult result, Instant at) {
        StringBuilder sb = new StringBuilder();
        sb.append("🤖 <b>Trade Analysis Alert</b>\n\n");
        sb.append("📊 <b>").append(escape(schedule.getDisplayLabel())).append("</b>\n");
        sb.append("⏰ ").append(TIMESTAMP_FORMAT.format(at)).append("\n\n");

        sb.append("<b>Action:</b> ").append(actionLabel(result.getAction())).append('\n');
        sb.append("<b>Confidence:</b> ").append(result.getConfidence()).append("% ")
                .append(confidenceMeter(result.getConfidence())).append('\n');
        if (result.getTimeframe() != null && !result.getTimeframe().isBlank()) {
            sb.append("<b>Timeframe:</b> ").append(escape(result.getTimeframe())).append('\n');
        }
        sb.append('\n');

        TradeSetup setup = result.getTradeSetup();
        if (setup != null && setup.isComplete() && result.getAction() != SignalAction.HOLD) {
            appendTradeSetup(sb, setup);
        }

        if (result.getReasons() != null && !result.getReasons().isEmpty()) {
            String firstReason = result.getReasons().get(0);
            String summary = firstReason.length() > MAX_REASON_LENGTH
                    ? firstReason.substring(0, MAX_REASON_LENGTH) + "..."
                    : firstReason;
            sb.append("📝 <b>Analysis:</b> ").append(escape(summary)).append("\n\n");
        }

        if (result.getAnalysisId() != null) {
            sb.append("🔗 <a href=\"").append(escape(analysisUrl(result.getAnalysisId())))
                    .append("\">View Full Analysis</a>");
        }
        return sb.toString().stripTrailing();
    }

    public String formatConnectionTest() {
        return "✅ <b>Telegram Connection Successful!</b>\n\n"
                + "Your trading alerts will be sent to this chat.\n\n"
                + "🤖 Automation is now active!";
    }

    public String formatErrorAlert(AutomationSchedule schedule, String errorMessage, Instant at) {
        return "⚠️ <b>Automation Error</b>\n\n"
                + "📊 Layout: " + escape(schedule.getDisplayLabel()) + "\n"
                + "❌ Error: " + escape(errorMessage != null ? errorMessage : "unknown error") + "\n\n"
                + "⏰ " + TIMESTAMP_FORMAT.format(at);
    }

    private static void appendTradeSetup(StringBuilder sb, TradeSetup setup) {
        sb.append("💼 <b>Trade Setup</b>");
        if (setup.getQuality() != null && !setup.getQuality().isBlank()) {
            sb.append(" (").append(escape(setup.getQuality())).append(')');
        }
        sb.append('\n');
        sb.append("Entry: <code>").append(formatPrice(setup.getEntryPrice())).append("</code>\n");
        sb.append("Stop Loss: <code>").append(formatPrice(setup.getStopLoss())).append("</code>\n");
        sb.append("Target: <code>").append(formatPrice(setup.getTargetPrice())).append("</code>\n");
        double risk = setup.getEntryPrice() - setup.getStopLoss();
        if (risk != 0) {
            double reward = setup.getTargetPrice() - setup.getEntryPrice();
            sb.append("R:R Ratio: <code>1:").append(String.format(Locale.ROOT, "%.2f", reward / risk))
                    .append("</code>\n");
        }
        sb.append('\n');

        List<String> reasons = setup.getReasons();
        if (reasons != null && !reasons.isEmpty()) {
            sb.append("<b>Key Reasons:</b>\n");
            for (int i = 0; i < Math.min(MAX_KEY_REASONS, reasons.size()); i++) {
                sb.append(i + 1).append(". ").append(escape(reasons.get(i))).append('\n');
            }
            sb.append('\n');
        }
    }

    /**
     * Price with precision by magnitude: 5 decimals below 10 (forex), 3 below
     * 1000 (stocks), otherwise 2 (metals, crypto).
     */
    static String formatPrice(double price) {
        if (price < 10) {
            return String.format(Locale.ROOT, "%.5f", price);
        }
        if (price < 1000) {
            return String.format(Locale.ROOT, "%.3f", price);
        }
        return String.format(Locale.ROOT, "%.2f", price);
    }

    static String actionLabel(SignalAction action) {
        return switch (action) {
        case BUY -> "📈 BUY";
        case SELL -> "📉 SELL";
        case HOLD -> "⏸️ HOLD";
        };
    }

    static String confidenceMeter(int confidence) {
        if (confidence >= 90) {
            return "🟢🟢🟢";
        }
        if (confidence >= 70) {
            return "🟢🟢⚪";
        }
        if (confidence >= 50) {
            return "🟢⚪⚪";
        }
        if (confidence >= 30) {
            return "🟡⚪⚪";
        }
        return "🔴⚪⚪";
    }

    private String analysisUrl(String analysisId) {
        String base = properties.getTelegram().getAppBaseUrl();
        if (base == null || base.isBlank()) {
            base = "http://localhost:3000";
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/analysis/" + analysisId;
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
