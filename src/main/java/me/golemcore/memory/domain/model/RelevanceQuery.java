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

import java.util.ArrayList;
import java.util.List;

/**
 * Lookup parameters for retrieving past interactions relevant to a new prompt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RelevanceQuery {

    public static final double DEFAULT_THRESHOLD = 0.3;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String domain;

    /**
     * Minimum relevance score an interaction needs to be returned.
     */
    @Builder.Default
    private double threshold = DEFAULT_THRESHOLD;
}
