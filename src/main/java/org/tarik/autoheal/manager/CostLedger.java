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

import java.math.BigDecimal;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.math.BigDecimal.ZERO;

/**
 * Spend of a single run. The paid calls of an attempt are preceded by {@link #reserve(BigDecimal)}, which holds the
 * estimated cost against both the per-run and the daily ceiling. They are followed by one
 * {@link #record(BigDecimal, String)} or {@link #record(Map)} once they returned, or by {@link #release()} if their
 * result was discarded. Spend only grows.
 * <p>
 * Not shared between runs, only the {@link DailySpendTracker} behind it is.
 */
public class CostLedger {
    private static final Logger LOG = LoggerFactory.getLogger(CostLedger.class);
    private final DailySpendTracker dailySpendTracker;
    private final BigDecimal perRunCeiling;
    private BigDecimal runSpend = ZERO;
    private BigDecimal outstandingReservation;

    public CostLedger(@NotNull DailySpendTracker dailySpendTracker, @NotNull BigDecimal perRunCeiling) {
        checkArgument(perRunCeiling.compareTo(ZERO) > 0, "Per-run ceiling must be positive, got %s", perRunCeiling);
        this.dailySpendTracker = dailySpendTracker;
        this.perRunCeiling = perRunCeiling;
    }

    /**
     * Checks whether a call with the given estimated cost may be issued and holds the estimate if so.
     *
     * @return false if the run spend or the daily spend plus the estimate would exceed its ceiling
     */
    public synchronized boolean reserve(@NotNull BigDecimal estimatedCost) {
        checkArgument(estimatedCost.compareTo(ZERO) >= 0, "Estimated cost can't be negative: %s", estimatedCost);
        checkState(outstandingReservation == null, "Previous reservation of $%s is neither recorded nor released",
                outstandingReservation);
        var projectedRunSpend = runSpend.add(estimatedCost);
        if (projectedRunSpend.compareTo(perRunCeiling) > 0) {
            LOG.warn("Run budget would be exceeded: ${} / ${}", projectedRunSpend.toPlainString(),
                    perRunCeiling.toPlainString());
            return false;
        }
        if (!dailySpendTracker.tryReserve(estimatedCost)) {
            return false;
        }
        outstandingReservation = estimatedCost;
        return true;
    }

    public void record(@NotNull BigDecimal actualCost) {
        record(actualCost, null);
    }

    /**
     * Commits the actual spend of a completed call, replacing the outstanding reservation.
     */
    public synchronized void record(@NotNull BigDecimal actualCost, @Nullable String source) {
        checkArgument(actualCost.compareTo(ZERO) >= 0, "Actual cost can't be negative: %s", actualCost);
        var held = outstandingReservation == null ? ZERO : outstandingReservation;
        outstandingReservation = null;
        dailySpendTracker.commit(held, actualCost, source);
        runSpend = runSpend.add(actualCost);
        LOG.debug("Recorded ${} (run total ${})", actualCost.toPlainString(), runSpend.toPlainString());
    }

    /**
     * Commits the actual spend of every service a completed attempt used, replacing the outstanding reservation as
     * a whole. An attempt which paid more than one service must be booked with this method, since booking the
     * costs one by one would free the rest of the hold before the remaining costs are booked.
     */
    public synchronized void record(@NotNull Map<String, BigDecimal> costsBySource) {
        checkArgument(!costsBySource.isEmpty(), "At least one cost must be recorded");
        var total = costsBySource.values().stream().reduce(ZERO, BigDecimal::add);
        var held = outstandingReservation == null ? ZERO : outstandingReservation;
        dailySpendTracker.commit(held, costsBySource);
        outstandingReservation = null;
        runSpend = runSpend.add(total);
        LOG.debug("Recorded ${} from {} (run total ${})", total.toPlainString(), costsBySource.keySet(),
                runSpend.toPlainString());
    }

    /**
     * Drops the outstanding reservation without booking any spend.
     */
    public synchronized void release() {
        if (outstandingReservation != null) {
            dailySpendTracker.release(outstandingReservation);
            outstandingReservation = null;
        }
    }

    public synchronized BigDecimal getRunSpend() {
        return runSpend;
    }

    public BigDecimal getPerRunCeiling() {
        return perRunCeiling;
    }

    public synchronized boolean hasOutstandingReservation() {
        return outstandingReservation != null;
    }
}
