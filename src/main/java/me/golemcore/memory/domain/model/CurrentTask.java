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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Task an agent is working on. All fields are null while the agent is not busy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrentTask {

    private String taskId;
    private Integer issueNumber;
    private String stream;
    private Instant startedAt;
    private Instant estimatedCompletion;

    @JsonIgnore
    public boolean isAssigned() {
        return taskId != null || startedAt != null;
    }

    public static CurrentTask none() {
        return new CurrentTask();
    }
}
