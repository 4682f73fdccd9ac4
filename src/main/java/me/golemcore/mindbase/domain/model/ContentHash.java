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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * SHA-256 based identifiers shared by collectors and the normalizer. Identical
 * inputs always produce identical ids.
 */
public final class ContentHash {

    private static final int SHORT_ID_LENGTH = 16;

    private ContentHash() {
    }

    /**
     * {@code msg_} + 16 hex chars of sha256("role:content").
     */
    public static String messageId(String role, String content) {
        return "msg_" + sha256(role + ":" + content).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * {@code conv_} + 16 hex chars of sha256("source:threadId:createdAt").
     */
    public static String conversationId(String source, String threadId, Instant createdAt) {
        return "conv_" + sha256(source + ":" + threadId + ":" + createdAt).substring(0, SHORT_ID_LENGTH);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
