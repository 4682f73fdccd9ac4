package me.golemcore.mindbase.collector;

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

import me.golemcore.mindbase.domain.model.AdapterStats;
import me.golemcore.mindbase.domain.model.Conversation;
import me.golemcore.mindbase.domain.model.ConversationSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Reads the local history of one AI tool into canonical conversations.
 *
 * <p>
 * Collection is best-effort: a file, row or key that cannot be read is logged,
 * counted in {@link #getStats()} and skipped, so {@link #collect(Instant)}
 * returns whatever could be recovered and never throws.
 */
public interface SourceAdapter {

    ConversationSource getSource();

    /**
     * Existing storage locations of the tool on this machine.
     */
    List<Path> discoverStoragePaths();

    /**
     * Collects conversations created or updated at or after {@code since}.
     *
     * @param since
     *            lower bound, or {@code null} for everything
     */
    List<Conversation> collect(Instant since);

    /**
     * Statistics of the last {@link #collect(Instant)} call.
     */
    AdapterStats getStats();
}
