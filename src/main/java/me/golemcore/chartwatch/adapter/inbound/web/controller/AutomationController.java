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

import me.golemcore.chartwatch.auto.AutomationScheduler;
import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.Frequency;
import me.golemcore.chartwatch.domain.model.JobLog;
import me.golemcore.chartwatch.domain.model.ScheduleSettings;
import me.golemcore.chartwatch.domain.service.ScheduleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Operator endpoints for automation schedules, run history and the scheduler.
 */
@RestController
@RequestMapping("/api/automation")
@RequiredArgsConstructor
public class AutomationController {

    private final ScheduleService scheduleService;
    private final AutomationScheduler automationScheduler;

    @GetMapping
    public Mono<ResponseEntity<List<ScheduleDto>>> listSchedules() {
        List<ScheduleDto> schedules = scheduleService.getSchedules().stream()
                .map(AutomationController::toScheduleDto)
                .toList();
        return Mono.just(ResponseEntity.ok(schedules));
    }

    @PostMapping
    public Mono<ResponseEntity<ScheduleDto>> upsertSchedule(@RequestBody UpsertScheduleRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        if (request.targetRef() == null || request.targetRef().isBlank()) {
            throw badRequest("targetRef is required");
        }

        ScheduleService.UpsertResult result = scheduleService.upsertSchedule(request.targetRef(),
                toSettings(request.targetLabel(), request.enabled(), request.frequency(),
                        request.sendToTelegram(), request.onlyOnSignalChange(), request.minConfidence(),
                        request.sendOnHold(), request.telegramChatId()));
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return Mono.just(ResponseEntity.status(status).body(toScheduleDto(result.schedule())));
    }

    @PatchMapping("/{scheduleId}")
    public Mono<ResponseEntity<ScheduleDto>> updateSchedule(@PathVariable String scheduleId,
            @RequestBody UpdateScheduleRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        AutomationSchedule updated = scheduleService.updateSchedule(scheduleId,
                toSettings(request.targetLabel(), request.enabled(), request.frequency(),
                        request.sendToTelegram(), request.onlyOnSignalChange(), request.minConfidence(),
                        request.sendOnHold(), request.telegramChatId()));
        return Mono.just(ResponseEntity.ok(toScheduleDto(updated)));
    }

    @DeleteMapping("/{scheduleId}")
    public Mono<ResponseEntity<DeleteScheduleResponse>> deleteSchedule(@PathVariable String scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return Mono.just(ResponseEntity.ok(new DeleteScheduleResponse(scheduleId)));
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<JobLogsResponse>> getLogs(
            @RequestParam(required = false) String scheduleId,
            @RequestParam(required = false) Integer limit) {
        List<JobLog> logs = scheduleId != null && !scheduleId.isBlank()
                ? scheduleService.getJobLogs(scheduleId, limit)
                : scheduleService.getRecentJobLogs(limit);
        return Mono.just(ResponseEntity.ok(new JobLogsResponse(logs, logs.size())));
    }

    @PostMapping("/trigger")
    public Mono<ResponseEntity<TriggerResponse>> triggerAll() {
        int submitted = automationScheduler.triggerAllNow();
        return Mono.just(ResponseEntity.ok(new TriggerResponse(submitted)));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<StatusResponse>> getStatus() {
        return Mono.just(ResponseEntity.ok(new StatusResponse(
                automationScheduler.isRunning(),
                automationScheduler.inFlightCount())));
    }

    private static ScheduleSettings toSettings(String targetLabel, Boolean enabled, String frequency,
            Boolean sendToTelegram, Boolean onlyOnSignalChange, Integer minConfidence, Boolean sendOnHold,
            String telegramChatId) {
        return ScheduleSettings.builder()
                .targetLabel(targetLabel)
                .enabled(enabled)
                .frequency(frequency != null ? Frequency.fromCode(frequency) : null)
                .sendToTelegram(sendToTelegram)
                .onlyOnSignalChange(onlyOnSignalChange)
                .minConfidence(minConfidence)
                .sendOnHold(sendOnHold)
                .telegramChatId(telegramChatId)
                .build();
    }

    private static ScheduleDto toScheduleDto(AutomationSchedule schedule) {
        return new ScheduleDto(
                schedule.getId(),
                schedule.getTargetRef(),
                schedule.getDisplayLabel(),
                schedule.isEnabled(),
                schedule.getFrequency().getCode(),
                schedule.isSendToTelegram(),
                schedule.isOnlyOnSignalChange(),
                schedule.getMinConfidence(),
                schedule.isSendOnHold(),
                schedule.getTelegramChatId(),
                schedule.getCreatedAt(),
                schedule.getUpdatedAt(),
                schedule.getLastRunAt(),
                schedule.getNextRunAt());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record UpsertScheduleRequest(
            String targetRef,
            String targetLabel,
            Boolean enabled,
            String frequency,
            Boolean sendToTelegram,
            Boolean onlyOnSignalChange,
            Integer minConfidence,
            Boolean sendOnHold,
            String telegramChatId) {
    }

    public record UpdateScheduleRequest(
            String targetLabel,
            Boolean enabled,
            String frequency,
            Boolean sendToTelegram,
            Boolean onlyOnSignalChange,
            Integer minConfidence,
            Boolean sendOnHold,
            String telegramChatId) {
    }

    public record ScheduleDto(
            String id,
            String targetRef,
            String targetLabel,
            boolean enabled,
            String frequency,
            boolean sendToTelegram,
            boolean onlyOnSignalChange,
            int minConfidence,
            boolean sendOnHold,
            String telegramChatId,
            Instant createdAt,
            Instant updatedAt,
            Instant lastRunAt,
            Instant nextRunAt) {
    }

    public record JobLogsResponse(List<JobLog> logs, int count) {
    }

    public record DeleteScheduleResponse(String scheduleId) {
    }

    public record TriggerResponse(int submitted) {
    }

    public record StatusResponse(boolean running, int inFlight) {
    }
}
