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

/**
 * A tier failed after it had already started streaming. No promotion happens
 * past that point, so the failure ends the call.
 */
public class StreamFailedException extends AgentRuntimeException {

    private final String model;
    private final String partialContent;

    public StreamFailedException(String model, String partialContent, Throwable cause) {
        super("Stream from " + model + " failed after first token: " + cause.getMessage(), cause);
        this.model = model;
        this.partialContent = partialContent;
    }

    public String getModel() {
        return model;
    }

    public String getPartialContent() {
        return partialContent;
    }
}
