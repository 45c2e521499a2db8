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

import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import me.golemcore.chartwatch.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Verifies that alerts can reach a Telegram chat by sending a confirmation
 * message to it.
 */
@Service
@Slf4j
public class TelegramConnectionService {

    private final NotificationPort notificationPort;
    private final AlertMessageFormatter messageFormatter;
    private final ChartWatchProperties properties;

    public TelegramConnectionService(NotificationPort notificationPort, AlertMessageFormatter messageFormatter,
            ChartWatchProperties properties) {
        this.notificationPort = notificationPort;
        this.messageFormatter = messageFormatter;
        this.properties = properties;
    }

    /**
     * Send the confirmation message to {@code chatId}, or to the configured
     * default chat when it is blank.
     *
     * @return whether Telegram accepted the message
     * @throws IllegalArgumentException
     *             if no chat id is given and no default is configured
     */
    public boolean testConnection(String chatId) {
        String target = resolveChatId(chatId);
        if (!notificationPort.isAvailable()) {
            log.warn("[Telegram] Connection test to chat {} skipped: notifications are not configured", target);
            return false;
        }
        Duration timeout = properties.getAutomation().getNotificationTimeout();
        try {
            notificationPort.send(target, messageFormatter.formatConnectionTest())
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Telegram] Connection test message sent to chat {}", target);
            return true;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Telegram] Connection test to chat {} failed: {}", target, cause.getMessage());
            return false;
        } catch (TimeoutException e) {
            log.warn("[Telegram] Connection test to chat {} timed out after {}s", target, timeout.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Connection test interrupted", e);
        }
    }

    private String resolveChatId(String chatId) {
        if (chatId != null && !chatId.isBlank()) {
            return chatId.trim();
        }
        String fallback = properties.getTelegram().getDefaultChatId();
        if (fallback == null || fallback.isBlank()) {
            throw new IllegalArgumentException("Chat ID is required");
        }
        return fallback.trim();
    }
}
