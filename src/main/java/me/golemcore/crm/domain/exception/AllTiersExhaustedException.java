package me.golemcore.crm.domain.exception;

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

import me.golemcore.crm.domain.model.TierFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every tier of a model chain timed out or failed. Fatal to the turn.
 */
public class AllTiersExhaustedException extends AgentRuntimeException {

    private final List<TierFailure> failures;

    public AllTiersExhaustedException(List<TierFailure> failures) {
        super("All model tiers exhausted: " + failures.stream()
                .map(TierFailure::toString)
                .collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
    }

    /**
     * One entry per attempted tier, in tier order.
     */
    public List<TierFailure> getFailures() {
        return failures;
    }
}
