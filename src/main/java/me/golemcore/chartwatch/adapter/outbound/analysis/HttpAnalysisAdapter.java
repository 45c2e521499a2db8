package me.golemcore.chartwatch.adapter.outbound.analysis;

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

import me.golemcore.chartwatch.domain.model.AnalysisException;
import me.golemcore.chartwatch.domain.model.AnalysisResult;
import me.golemcore.chartwatch.domain.model.SignalAction;
import me.golemcore.chartwatch.domain.model.TradeSetup;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import me.golemcore.chartwatch.infrastructure.http.FeignClientFactory;
import me.golemcore.chartwatch.port.outbound.AnalysisPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link AnalysisPort} backed by the chart analysis service over HTTP.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code chartwatch.analysis.base-url} - analysis service root (required)
 * <li>{@code chartwatch.analysis.api-key} - bearer token (optional)
 * </ul>
 *
 * <p>
 * The service captures the target chart, analyses it and answers with the
 * stored analysis: {@code {id, action, confidence, timeframe, reasons,
 * tradeSetup}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpAnalysisAdapter implements AnalysisPort {

    private static final ExecutorService ANALYSIS_EXECUTOR = Executors.newFixedThreadPool(4,
            r -> {
                Thread t = new Thread(r, "analysis-call");
                t.setDaemon(true);
                return t;
            });

    private final FeignClientFactory feignClientFactory;
    private final ChartWatchProperties properties;

    private volatile AnalysisApi analysisApi;

    @Override
    public CompletableFuture<AnalysisResult> analyze(String targetRef) {
        return CompletableFuture.supplyAsync(() -> {
            AnalysisApi api = getApi();
            log.debug("[Analysis] Requesting analysis of {}", targetRef);
            AnalysisResponse response;
            try {
                response = api.analyze(authorization(), new AnalysisRequest(targetRef));
            } catch (FeignException e) {
                log.warn("[Analysis] Provider returned HTTP {} for {}", e.status(), targetRef);
                throw new AnalysisException("Analysis provider returned HTTP " + e.status(), e);
            }
            return toResult(response);
        }, ANALYSIS_EXECUTOR);
    }

    static AnalysisResult toResult(AnalysisResponse response) {
        if (response == null) {
            throw new AnalysisException("Analysis provider returned an empty response");
        }
        if (response.getAction() == null || response.getAction().isBlank()) {
            throw new AnalysisException("Analysis provider returned no action");
        }
        if (response.getConfidence() == null) {
            throw new AnalysisException("Analysis provider returned no confidence");
        }
        SignalAction action;
        try {
            action = SignalAction.valueOf(response.getAction().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AnalysisException("Unknown action: " + response.getAction(), e);
        }
        return AnalysisResult.builder()
                .action(action)
                .confidence(response.getConfidence())
                .analysisId(response.getId())
                .timeframe(response.getTimeframe())
                .reasons(response.getReasons() != null ? response.getReasons() : new ArrayList<>())
                .tradeSetup(toTradeSetup(response.getTradeSetup()))
                .build();
    }

    private static TradeSetup toTradeSetup(TradeSetupResponse setup) {
        if (setup == null) {
            return null;
        }
        return TradeSetup.builder()
                .quality(setup.getQuality())
                .entryPrice(setup.getEntryPrice())
                .stopLoss(setup.getStopLoss())
                .targetPrice(setup.getTargetPrice())
                .description(setup.getSetupDescription())
                .reasons(setup.getReasons() != null ? setup.getReasons() : new ArrayList<>())
                .build();
    }

    private AnalysisApi getApi() {
        AnalysisApi api = analysisApi;
        if (api != null) {
            return api;
        }
        synchronized (this) {
            if (analysisApi == null) {
                String baseUrl = properties.getAnalysis().getBaseUrl();
                if (baseUrl == null || baseUrl.isBlank()) {
                    throw new AnalysisException("Analysis provider is not configured");
                }
                analysisApi = feignClientFactory.create(AnalysisApi.class, baseUrl);
                log.info("[Analysis] Client initialized for {}", baseUrl);
            }
            return analysisApi;
        }
    }

    private String authorization() {
        String apiKey = properties.getAnalysis().getApiKey();
        return apiKey != null && !apiKey.isBlank() ? "Bearer " + apiKey : "";
    }

    // Feign API interface
    interface AnalysisApi {
        @RequestLine("POST /api/analyses")
        @Headers({
                "Content-Type: application/json",
                "Accept: application/json",
                "Authorization: {authorization}"
        })
        AnalysisResponse analyze(@Param("authorization") String authorization, AnalysisRequest request);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class AnalysisRequest {
        private String targetRef;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AnalysisResponse {
        private String id;
        private String action;
        private Integer confidence;
        private String timeframe;
        private List<String> reasons;
        private TradeSetupResponse tradeSetup;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TradeSetupResponse {
        private String quality;
        private Double entryPrice;
        private Double stopLoss;
        private Double targetPrice;
        private String setupDescription;
        private List<String> reasons;
    }
}
