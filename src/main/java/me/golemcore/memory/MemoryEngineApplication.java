package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore memory engine.
 *
 * <p>
 * The engine decides which pieces of agent-generated knowledge matter: it
 * scores hierarchical contexts, keeps a bounded interaction memory per agent,
 * ranks past interactions against new queries, and compresses history under
 * growth pressure.
 *
 * <h2>Components</h2>
 * <ul>
 * <li><b>Importance</b> - {@code ContextImportanceService} scores contexts from
 * structure, type and age</li>
 * <li><b>Agent memory</b> - {@code AgentMemoryService},
 * {@code MemoryRelevanceService}, {@code MemoryInsightService} and
 * {@code MemoryCompressionService} operate on {@code AgentMemory}
 * records</li>
 * <li><b>Agent state</b> - {@code AgentStateService} drives the task lifecycle
 * of {@code AgentRuntimeState}</li>
 * <li><b>Registry</b> - {@code AgentMemoryRegistry} serializes concurrent
 * access per agent memory</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code memory.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }

}
