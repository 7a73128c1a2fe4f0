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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.math.BigDecimal.ZERO;

public class InMemoryDailySpendStore implements DailySpendStore {
    private final Map<LocalDate, BigDecimal> spendByDay = new ConcurrentHashMap<>();

    @Override
    public BigDecimal load(LocalDate day) {
        return spendByDay.getOrDefault(day, ZERO);
    }

    @Override
    public void save(LocalDate day, BigDecimal spent) {
        spendByDay.put(day, spent);
    }
}
