package me.golemcore.chartwatch.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code chartwatch.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location for JSON documents</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link AutomationProperties} - scheduler tick, worker pool, leases and
 * call timeouts</li>
 * <li>{@link AnalysisProperties} - chart analysis service endpoint</li>
 * <li>{@link TelegramProperties} - alert delivery</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chartwatch")
@Data
public class ChartWatchProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private AutomationProperties automation = new AutomationProperties();
    private AnalysisProperties analysis = new AnalysisProperties();
    private TelegramProperties telegram = new TelegramProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.chartwatch/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;

        /** Whole-request deadline; 0 disables it. */
        private long callTimeout = 240000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== AUTOMATION ====================

    @Data
    public static class AutomationProperties {
        private boolean enabled = true;
        private int tickIntervalSeconds = 60;
        private int initialDelaySeconds = 10;

        /** Upper bound on concurrent runs, and so on concurrent analysis calls. */
        private int workerPoolSize = 2;

        /** A lease older than this is considered abandoned and can be reclaimed. */
        private Duration leaseTimeout = Duration.ofMinutes(30);

        private Duration analysisTimeout = Duration.ofMinutes(5);
        private Duration notificationTimeout = Duration.ofSeconds(30);
        private int shutdownTimeoutSeconds = 5;
    }

    @Data
    public static class AnalysisProperties {
        private String baseUrl;
        private String apiKey;
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private String defaultChatId;
        private String appBaseUrl = "http://localhost:3000";
    }
}
