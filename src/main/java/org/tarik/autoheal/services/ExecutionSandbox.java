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
package org.tarik.autoheal.services;

import org.tarik.autoheal.exceptions.SandboxTimeoutException;
import org.tarik.autoheal.exceptions.ServiceException;

import java.math.BigDecimal;

import static java.math.BigDecimal.ZERO;

/**
 * Runs automation code in an isolated browser and reports what happened. A script which fails is a normal
 * response with a failure status, not an exception.
 */
public interface ExecutionSandbox {
    /**
     * @throws SandboxTimeoutException if the execution didn't finish within the requested timeout
     * @throws ServiceException        if the sandbox itself failed
     */
    SandboxResponse execute(SandboxRequest request);

    /**
     * Upper estimate of what executing a script with the given timeout costs, known before the script exists.
     */
    default BigDecimal estimateCost(long timeoutMs) {
        return ZERO;
    }
}
