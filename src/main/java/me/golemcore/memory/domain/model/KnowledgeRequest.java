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
 * A learned concept to store under a knowledge domain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeRequest {

    private String domain;
    private String concept;
    private String value;

    @Builder.Default
    private double confidence = 0.7;

    @Builder.Default
    private String source = "interaction";

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
