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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive, time-bounded run leases keyed by schedule id.
 *
 * <p>
 * At most one live lease exists per schedule. A lease that outlives the
 * configured timeout is treated as abandoned and the next
 * {@link #tryAcquire(String)} reclaims it. Releasing is token-checked, so the
 * holder of a reclaimed lease cannot release its successor.
 */
@Component
@Slf4j
public class RunLeaseRegistry {

    private final Map<String, LeaseState> leases = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration leaseTimeout;

    @Autowired
    public RunLeaseRegistry(ChartWatchProperties properties, Clock clock) {
        this(clock, properties.getAutomation().getLeaseTimeout());
    }

    RunLeaseRegistry(Clock clock, Duration leaseTimeout) {
        if (leaseTimeout == null || leaseTimeout.isNegative() || leaseTimeout.isZero()) {
            throw new IllegalArgumentException("leaseTimeout must be positive");
        }
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
    }

    /**
     * Try to take the run lease for a schedule.
     *
     * @return the lease, or empty if another live lease is held
     */
    public Optional<RunLease> tryAcquire(String scheduleId) {
        Instant now = clock.instant();
        String token = UUID.randomUUID().toString();
        LeaseState candidate = new LeaseState(token, now, now.plus(leaseTimeout));

        LeaseState winner = leases.compute(scheduleId, (id, current) -> {
            if (current == null) {
                return candidate;
            }
            if (current.isExpired(now)) {
                log.warn("[Lease] Reclaiming abandoned lease for schedule {} (acquired at {})",
                        id, current.acquiredAt());
                return candidate;
            }
            return current;
        });

        if (winner != candidate) {
            log.debug("[Lease] Schedule {} is already running", scheduleId);
            return Optional.empty();
        }
        return Optional.of(new RunLease(scheduleId, token));
    }

    /**
     * Whether a live (non-expired) lease is held for the schedule.
     */
    public boolean isHeld(String scheduleId) {
        LeaseState state = leases.get(scheduleId);
        return state != null && !state.isExpired(clock.instant());
    }

    public int activeLeaseCount() {
        Instant now = clock.instant();
        return (int) leases.values().stream().filter(state -> !state.isExpired(now)).count();
    }

    private void release(String scheduleId, String token) {
        boolean removed = leases.computeIfPresent(scheduleId,
                (id, current) -> current.token().equals(token) ? null : current) == null;
        if (!removed) {
            log.warn("[Lease] Lease for schedule {} was reclaimed before release", scheduleId);
        }
    }

    private record LeaseState(String token, Instant acquiredAt, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    /**
     * A held run lease. Closing it releases the lease; closing twice is a no-op.
     */
    public final class RunLease implements AutoCloseable {

        private final String scheduleId;
        private final String token;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private RunLease(String scheduleId, String token) {
            this.scheduleId = scheduleId;
            this.token = token;
        }

        public String getScheduleId() {
            return scheduleId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(scheduleId, token);
            }
        }
    }
}
