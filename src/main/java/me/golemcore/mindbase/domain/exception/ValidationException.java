package me.golemcore.mindbase.domain.exception;

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

import java.util.List;

/**
 * A conversation failed structural checks after normalization.
 */
public class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String conversationId;
    private final transient List<String> issues;

    public ValidationException(String conversationId, List<String> issues) {
        super("Conversation " + conversationId + " failed validation: " + String.join("; ", issues));
        this.conversationId = conversationId;
        this.issues = List.copyOf(issues);
    }

    public String getConversationId() {
        return conversationId;
    }

    public List<String> getIssues() {
        return issues;
    }
}
