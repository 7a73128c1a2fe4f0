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
package org.tarik.autoheal.error;

import org.tarik.autoheal.dto.Diagnosis;
import org.tarik.autoheal.dto.ExecutionTrace;

import java.util.Optional;

/**
 * One entry of the ordered rule list the {@link ErrorClassifier} applies. Implementations must be deterministic and
 * free of side effects.
 */
public interface ClassificationRule {
    String name();

    Optional<Diagnosis> classify(ExecutionTrace trace, long timeoutMillis);
}
