package me.golemcore.crm.domain.worker;

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

import lombok.Builder;
import lombok.Data;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ModelTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a worker needs for one model call.
 */
@Data
@Builder(toBuilder = true)
public class WorkerInvocation {

    private String sessionId;
    private String userId;
    private String userMessage;

    @Builder.Default
    private List<Message> history = new ArrayList<>();

    private ModelTarget target;

    /** Evaluator feedback on the previous attempt, set on retries only. */
    private String feedback;
}
