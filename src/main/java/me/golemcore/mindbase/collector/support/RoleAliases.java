package me.golemcore.mindbase.collector.support;

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

import me.golemcore.mindbase.domain.model.Message;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the role vocabulary of the supported tools onto {@code user},
 * {@code assistant} and {@code system}. Unknown roles become
 * {@code assistant}.
 */
public final class RoleAliases {

    private static final Map<String, Set<String>> ALIASES = Map.of(
            Message.ROLE_USER, Set.of("user", "human", "me", "question", "prompt", "input"),
            Message.ROLE_ASSISTANT, Set.of("assistant", "ai", "bot", "claude", "chatgpt", "gpt", "cursor",
                    "windsurf", "response", "completion", "output", "cascade", "codeium", "model"),
            Message.ROLE_SYSTEM, Set.of("system", "instruction", "context"));

    private RoleAliases() {
    }

    public static String normalize(String role) {
        if (role == null) {
            return Message.ROLE_ASSISTANT;
        }
        String key = role.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Set<String>> entry : ALIASES.entrySet()) {
            if (entry.getValue().contains(key)) {
                return entry.getKey();
            }
        }
        return Message.ROLE_ASSISTANT;
    }

    public static boolean isCanonical(String role) {
        return Message.ROLE_USER.equals(role)
                || Message.ROLE_ASSISTANT.equals(role)
                || Message.ROLE_SYSTEM.equals(role);
    }
}
