package me.golemcore.mindbase.port.outbound;

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

import me.golemcore.mindbase.domain.model.DerivedConversationRecord;
import me.golemcore.mindbase.domain.model.DerivedRecordFilter;
import me.golemcore.mindbase.domain.model.RawConversationRecord;
import me.golemcore.mindbase.domain.model.SearchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting raw captures and their derived records.
 *
 * <p>
 * Raw records are append-only: after insert only their derivation bookkeeping
 * is updated. At most one derived record exists per raw record.
 */
public interface ConversationStorePort {

    /**
     * Inserts a new raw record.
     *
     * @throws me.golemcore.mindbase.domain.exception.StorageConstraintException
     *             if a record with the same source and source conversation id
     *             already exists
     */
    RawConversationRecord insertRaw(RawConversationRecord record);

    Optional<RawConversationRecord> findRaw(String id);

    /**
     * Raw records not yet processed, oldest insert first.
     */
    List<RawConversationRecord> findUnprocessed(int limit);

    /**
     * Persists the derivation bookkeeping of an existing raw record.
     */
    void updateRaw(RawConversationRecord record);

    /**
     * Inserts the derived record of a raw record.
     *
     * @throws IllegalStateException
     *             if the raw record already has a derived record
     */
    DerivedConversationRecord insertDerived(DerivedConversationRecord record);

    Optional<DerivedConversationRecord> findDerivedByRawId(String rawId);

    /**
     * Derived records matching the filter whose embedding similarity to the query
     * vector, under the configured distance operator, is at least
     * {@code minSimilarity}; most similar first.
     */
    List<SearchCandidate> findSimilar(float[] embedding, DerivedRecordFilter filter, double minSimilarity);

    /**
     * Derived records matching the filter, newest first.
     */
    List<DerivedConversationRecord> findDerived(DerivedRecordFilter filter);
}
