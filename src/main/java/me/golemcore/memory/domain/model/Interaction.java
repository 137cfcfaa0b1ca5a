package me.golemcore.memory.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One recorded agent exchange with its outcome metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Interaction {

    private String id;
    private Instant timestamp;

    @Builder.Default
    private String prompt = "";

    @Builder.Default
    private String response = "";

    private boolean success;

    /**
     * Duration in milliseconds.
     */
    private long duration;

    private int tokens;
    private String contextId;
    private InteractionFeedback feedback;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Prompt text, never null. A payload carrying an explicit null reads as
     * empty.
     */
    public String getPrompt() {
        return prompt != null ? prompt : "";
    }

    public String getResponse() {
        return response != null ? response : "";
    }

    /**
     * Detached copy that shares no mutable state with this record.
     */
    public Interaction copy() {
        return toBuilder()
                .prompt(getPrompt())
                .response(getResponse())
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .feedback(feedback != null ? feedback.toBuilder().build() : null)
                .build();
    }

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }
}
