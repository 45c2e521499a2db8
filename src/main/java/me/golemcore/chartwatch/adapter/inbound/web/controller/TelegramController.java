package me.golemcore.chartwatch.adapter.inbound.web.controller;

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

import me.golemcore.chartwatch.domain.service.TelegramConnectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Telegram delivery checks.
 */
@RestController
@RequestMapping("/api/telegram")
@RequiredArgsConstructor
public class TelegramController {

    private final TelegramConnectionService connectionService;

    @PostMapping("/test")
    public Mono<ResponseEntity<TestConnectionResponse>> testConnection(
            @RequestBody(required = false) TestConnectionRequest request) {
        String chatId = request != null ? request.chatId() : null;
        boolean success = connectionService.testConnection(chatId);
        return Mono.just(ResponseEntity.ok(new TestConnectionResponse(success)));
    }

    public record TestConnectionRequest(String chatId) {
    }

    public record TestConnectionResponse(boolean success) {
    }
}
