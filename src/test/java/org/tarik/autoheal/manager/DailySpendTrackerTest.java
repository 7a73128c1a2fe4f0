/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
 */
package org.tarik.autoheal.manager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class DailySpendTrackerTest {
    private static final Instant LATE_EVENING_UTC = Instant.parse("2025-06-01T23:30:00Z");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Concurrent reservations never push the daily spend over the ceiling")
    void shouldNotOvershootCeilingUnderConcurrency() throws Exception {
        // Given
        var tracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("1.00"), ZoneOffset.UTC,
                Clock.systemUTC());
        int threads = 16;
        int reservationsPerThread = 50;
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var results = new ArrayList<Future<Integer>>();

        // When
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                int granted = 0;
                for (int j = 0; j < reservationsPerThread; j++) {
                    var amount = new BigDecimal("0.01");
                    if (tracker.tryReserve(amount)) {
                        granted++;
                        tracker.commit(amount, amount, "race");
                    }
                }
                return granted;
            }));
        }
        start.countDown();
        int totalGranted = 0;
        for (Future<Integer> result : results) {
            totalGranted += result.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(totalGranted).isEqualTo(100);
        assertThat(tracker.getSpentToday()).isEqualByComparingTo("1.00");
        assertThat(tracker.getReserved()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Outstanding reservations count against the ceiling")
    void shouldCountReservationsAgainstCeiling() {
        // Given
        var tracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("0.10"), ZoneOffset.UTC,
                Clock.systemUTC());
        tracker.tryReserve(new BigDecimal("0.08"));

        // When
        boolean granted = tracker.tryReserve(new BigDecimal("0.03"));

        // Then
        assertThat(granted).isFalse();
        assertThat(tracker.getReport().remaining()).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("The daily spend starts over when the calendar day changes")
    void shouldRollOverAtDayBoundary() {
        // Given
        var clock = new MutableClock(LATE_EVENING_UTC);
        var tracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("0.10"), ZoneOffset.UTC,
                clock);
        tracker.tryReserve(new BigDecimal("0.10"));
        tracker.commit(new BigDecimal("0.10"), new BigDecimal("0.10"), "model");
        assertThat(tracker.tryReserve(new BigDecimal("0.01"))).isFalse();

        // When
        clock.advance(Duration.ofHours(1));

        // Then
        assertThat(tracker.getSpentToday()).isEqualByComparingTo("0");
        assertThat(tracker.tryReserve(new BigDecimal("0.01"))).isTrue();
        assertThat(tracker.getReport().day()).isEqualTo(LocalDate.of(2025, 6, 2));
    }

    @Test
    @DisplayName("The reset boundary follows the configured zone")
    void shouldUseConfiguredResetZone() {
        // Given
        var clock = new MutableClock(LATE_EVENING_UTC);
        var tracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("1.00"),
                ZoneId.of("Europe/Berlin"), clock);

        // When / Then
        assertThat(tracker.getReport().day()).isEqualTo(LocalDate.of(2025, 6, 2));
    }

    @Test
    @DisplayName("The day's spend survives a restart through the JSON file")
    void shouldPersistSpendAcrossRestarts() throws IOException {
        // Given
        var file = tempDir.resolve("costs/daily_costs.json");
        var clock = new MutableClock(LATE_EVENING_UTC);
        var tracker = new DailySpendTracker(new JsonFileDailySpendStore(file), new BigDecimal("5.00"),
                ZoneOffset.UTC, clock);
        tracker.tryReserve(new BigDecimal("0.50"));
        tracker.commit(new BigDecimal("0.50"), new BigDecimal("0.42"), "model");

        // When
        var restarted = new DailySpendTracker(new JsonFileDailySpendStore(file), new BigDecimal("5.00"),
                ZoneOffset.UTC, clock);

        // Then
        assertThat(restarted.getSpentToday()).isEqualByComparingTo("0.42");
        assertThat(Files.readString(file, UTF_8)).contains("\"2025-06-01\"");
    }

    @Test
    @DisplayName("A corrupted spend file is treated as empty")
    void shouldIgnoreCorruptedFile() throws IOException {
        // Given
        var file = tempDir.resolve("daily_costs.json");
        Files.writeString(file, "{ not json", UTF_8);

        // When
        var store = new JsonFileDailySpendStore(file);

        // Then
        assertThat(store.load(LocalDate.of(2025, 6, 1))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Releasing a reservation frees the held amount")
    void shouldReleaseReservation() {
        // Given
        var tracker = new DailySpendTracker(new InMemoryDailySpendStore(), new BigDecimal("0.10"), ZoneOffset.UTC,
                Clock.systemUTC());
        tracker.tryReserve(new BigDecimal("0.10"));

        // When
        tracker.release(new BigDecimal("0.10"));

        // Then
        assertThat(tracker.getReserved()).isEqualByComparingTo("0");
        assertThat(tracker.tryReserve(new BigDecimal("0.10"))).isTrue();
    }
}
