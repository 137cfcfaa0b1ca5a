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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompressionOptions {

    /**
     * Newest interactions always retained as-is.
     */
    @Builder.Default
    private int keepRecentCount = 50;

    /**
     * History size above which compression runs. Older interactions are cut to
     * 30% of this value.
     */
    @Builder.Default
    private int compressionThreshold = 100;

    public int olderRetentionLimit() {
        return (int) Math.floor(compressionThreshold * 0.3);
    }
}
