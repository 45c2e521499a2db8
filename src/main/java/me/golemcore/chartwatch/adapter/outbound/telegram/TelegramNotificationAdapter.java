package me.golemcore.chartwatch.adapter.outbound.telegram;

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
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Outbound-only Telegram delivery of automation alerts.
 *
 * <p>
 * Messages are sent as HTML. If Telegram rejects the markup the message is
 * retried once as plain text with the tags stripped.
 */
@Component
@Slf4j
public class TelegramNotificationAdapter implements NotificationPort {

    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    private static final ExecutorService SEND_EXECUTOR = Executors.newFixedThreadPool(2,
            r -> {
                Thread t = new Thread(r, "telegram-send");
                t.setDaemon(true);
                return t;
            });

    private final ChartWatchProperties properties;

    private TelegramClient telegramClient;
    private boolean initialized = false;

    public TelegramNotificationAdapter(ChartWatchProperties properties) {
        this.properties = properties;
    }

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    synchronized void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    @Override
    public boolean isAvailable() {
        return properties.getTelegram().isEnabled() && getClient() != null;
    }

    @Override
    public CompletableFuture<Void> send(String chatId, String htmlMessage) {
        return CompletableFuture.runAsync(() -> {
            TelegramClient client = getClient();
            if (client == null) {
                throw new IllegalStateException("Telegram client is not configured");
            }
            String text = truncate(htmlMessage);
            SendMessage sendMessage = SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode("HTML")
                    .build();
            try {
                client.execute(sendMessage);
            } catch (TelegramApiException htmlEx) {
                log.debug("[Telegram] HTML parse failed, retrying as plain text: {}", htmlEx.getMessage());
                SendMessage plain = SendMessage.builder()
                        .chatId(chatId)
                        .text(truncate(stripTags(htmlMessage)))
                        .build();
                try {
                    client.execute(plain);
                } catch (TelegramApiException e) {
                    log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
                    throw new IllegalStateException("Telegram delivery failed: " + e.getMessage(), e);
                }
            }
        }, SEND_EXECUTOR);
    }

    private synchronized TelegramClient getClient() {
        if (initialized) {
            return telegramClient;
        }
        if (!properties.getTelegram().isEnabled()) {
            return null;
        }
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, alerts will not be delivered");
            initialized = true;
            return null;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
        log.info("[Telegram] Client initialized");
        return telegramClient;
    }

    static String stripTags(String html) {
        return html.replaceAll("<[^>]+>", "")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }

    private static String truncate(String text) {
        if (text.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
            return text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
        }
        return text;
    }
}
