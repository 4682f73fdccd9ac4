package me.golemcore.mindbase.domain.model;

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

/**
 * Optional equality filters over derived records. A {@code null} field matches
 * everything; {@code topic} matches by membership.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DerivedRecordFilter {

    private String source;
    private String project;
    private String topic;
    private String workspacePath;

    public static DerivedRecordFilter none() {
        return new DerivedRecordFilter();
    }

    public boolean matches(DerivedConversationRecord record) {
        if (source != null && !source.equals(record.getSource())) {
            return false;
        }
        if (project != null && !project.equals(record.getProject())) {
            return false;
        }
        if (workspacePath != null && !workspacePath.equals(record.getWorkspacePath())) {
            return false;
        }
        return topic == null || (record.getTopics() != null && record.getTopics().contains(topic));
    }
}
