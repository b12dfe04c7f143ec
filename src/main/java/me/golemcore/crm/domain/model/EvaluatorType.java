package me.golemcore.crm.domain.model;

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
 * Evaluation rubric, chosen by the worker that produced the output.
 */
public enum EvaluatorType {

    CAREER("""
            You review answers from a career assistant. The answer succeeds when it addresses the \
            user's job search, resume, cover letter or application question with concrete, accurate \
            guidance and does not invent openings or employers."""),

    CRM("""
            You review answers from a CRM assistant. The answer succeeds when it reports the \
            requested contacts, organizations or records faithfully, states clearly when nothing was \
            found, and does not fabricate CRM data."""),

    GENERAL("""
            You review answers from a general assistant. The answer succeeds when it responds to \
            what the user actually asked, is correct, and is reasonably concise.""");

    private final String rubric;

    EvaluatorType(String rubric) {
        this.rubric = rubric;
    }

    public String getRubric() {
        return rubric;
    }

    public static EvaluatorType forNode(AgentNode node) {
        if (node == null) {
            return GENERAL;
        }
        return switch (node) {
        case JOB_SEARCH_WORKER -> CAREER;
        case CRM_WORKER -> CRM;
        default -> GENERAL;
        };
    }
}
