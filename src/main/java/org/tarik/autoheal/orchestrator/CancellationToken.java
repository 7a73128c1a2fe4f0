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
package org.tarik.autoheal.orchestrator;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal of a run. Cancelling also interrupts the external call the run is currently waiting for.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<Future<?>> inFlightCall = new AtomicReference<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            var call = inFlightCall.get();
            if (call != null) {
                call.cancel(true);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void register(Future<?> call) {
        inFlightCall.set(call);
        // cancel() may have run between submitting the call and registering it
        if (cancelled.get()) {
            call.cancel(true);
        }
    }

    void clear() {
        inFlightCall.set(null);
    }
}
