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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.AgentConfig;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static java.math.BigDecimal.ZERO;

/**
 * Process-wide daily spend shared by all concurrent runs. Reservations are checked and held atomically, so
 * concurrent runs can't push the day's spend plus its outstanding reservations over the ceiling. The counter
 * starts from the durable store and rolls over to zero when the calendar day in the reset zone changes.
 */
public class DailySpendTracker implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DailySpendTracker.class);
    private static final String UNATTRIBUTED_SOURCE = "unattributed";

    private final DailySpendStore store;
    private final BigDecimal dailyCeiling;
    private final ZoneId resetZone;
    private final Clock clock;
    private final Map<String, BigDecimal> sessionSpendBySource = new TreeMap<>();
    private LocalDate currentDay;
    private BigDecimal spentToday;
    private BigDecimal reserved = ZERO;

    public DailySpendTracker(@NotNull DailySpendStore store, @NotNull BigDecimal dailyCeiling,
                             @NotNull ZoneId resetZone, @NotNull Clock clock) {
        checkArgument(dailyCeiling.compareTo(ZERO) > 0, "Daily budget must be positive, got %s", dailyCeiling);
        this.store = store;
        this.dailyCeiling = dailyCeiling;
        this.resetZone = resetZone;
        this.clock = clock;
        this.currentDay = today();
        this.spentToday = store.load(currentDay);
        LOG.info("Daily spend for {} initialized at ${} of ${}", currentDay, spentToday.toPlainString(),
                dailyCeiling.toPlainString());
    }

    public static DailySpendTracker fromConfig() {
        return new DailySpendTracker(new JsonFileDailySpendStore(AgentConfig.getDailySpendFile()),
                AgentConfig.getDailyBudget(), AgentConfig.getDailyResetZone(), Clock.systemUTC());
    }

    /**
     * Holds the given amount if today's spend, all outstanding reservations and the amount together stay within
     * the daily ceiling.
     *
     * @return true if the amount is now held, false if it would exceed the ceiling
     */
    public synchronized boolean tryReserve(@NotNull BigDecimal amount) {
        checkArgument(amount.compareTo(ZERO) >= 0, "Reserved amount can't be negative: %s", amount);
        rollOverIfNeeded();
        var projected = spentToday.add(reserved).add(amount);
        if (projected.compareTo(dailyCeiling) > 0) {
            LOG.warn("Daily budget would be exceeded: ${} / ${}", projected.toPlainString(),
                    dailyCeiling.toPlainString());
            return false;
        }
        reserved = reserved.add(amount);
        return true;
    }

    /**
     * Drops a held amount and books the actual spend in its place.
     */
    public synchronized void commit(@NotNull BigDecimal heldAmount, @NotNull BigDecimal actualCost,
                                    @Nullable String source) {
        checkArgument(actualCost.compareTo(ZERO) >= 0, "Actual cost can't be negative: %s", actualCost);
        rollOverIfNeeded();
        dropReservation(heldAmount);
        spentToday = spentToday.add(actualCost);
        sessionSpendBySource.merge(source == null ? UNATTRIBUTED_SOURCE : source, actualCost, BigDecimal::add);
        persist();
    }

    /**
     * Drops a held amount and books the actual spend of all the given sources in its place, in one step. No
     * reservation of another run can be granted between dropping the hold and booking the spend.
     */
    public synchronized void commit(@NotNull BigDecimal heldAmount, @NotNull Map<String, BigDecimal> costsBySource) {
        costsBySource.forEach((source, cost) ->
                checkArgument(cost.compareTo(ZERO) >= 0, "Actual cost of %s can't be negative: %s", source, cost));
        rollOverIfNeeded();
        dropReservation(heldAmount);
        costsBySource.forEach((source, cost) -> {
            spentToday = spentToday.add(cost);
            sessionSpendBySource.merge(source, cost, BigDecimal::add);
        });
        persist();
    }

    /**
     * Drops a held amount without booking anything, used when the reserved call never completed.
     */
    public synchronized void release(@NotNull BigDecimal heldAmount) {
        dropReservation(heldAmount);
    }

    public synchronized BigDecimal getSpentToday() {
        rollOverIfNeeded();
        return spentToday;
    }

    public synchronized BigDecimal getReserved() {
        return reserved;
    }

    public BigDecimal getDailyCeiling() {
        return dailyCeiling;
    }

    public synchronized CostReport getReport() {
        rollOverIfNeeded();
        var remaining = dailyCeiling.subtract(spentToday).max(ZERO);
        return new CostReport(currentDay, dailyCeiling, spentToday, reserved, remaining,
                Collections.unmodifiableMap(new TreeMap<>(sessionSpendBySource)));
    }

    /**
     * Writes the current day's spend to the store once more. Called on shutdown.
     */
    @Override
    public synchronized void close() {
        persist();
    }

    private void dropReservation(BigDecimal heldAmount) {
        checkArgument(heldAmount.compareTo(ZERO) >= 0, "Held amount can't be negative: %s", heldAmount);
        reserved = reserved.subtract(heldAmount).max(ZERO);
    }

    private void rollOverIfNeeded() {
        var today = today();
        if (!today.equals(currentDay)) {
            LOG.info("Daily spend boundary crossed: {} -> {}, closing the previous day at ${}", currentDay, today,
                    spentToday.toPlainString());
            currentDay = today;
            spentToday = store.load(today);
        }
    }

    private void persist() {
        try {
            store.save(currentDay, spentToday);
        } catch (UncheckedIOException e) {
            LOG.error("Daily spend of ${} for {} is kept in memory only", spentToday.toPlainString(), currentDay, e);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(resetZone));
    }
}
