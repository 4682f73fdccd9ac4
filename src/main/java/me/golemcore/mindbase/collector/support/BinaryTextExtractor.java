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

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls readable text out of binary storage files (LevelDB tables and logs).
 * Printable ASCII runs longer than {@value #MIN_RUN_LENGTH} characters are
 * kept and joined by single spaces.
 */
public final class BinaryTextExtractor {

    static final int MIN_RUN_LENGTH = 10;

    private BinaryTextExtractor() {
    }

    public static String extract(byte[] data) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (byte b : data) {
            int value = b & 0xFF;
            if (value >= 32 && value <= 126) {
                current.append((char) value);
            } else {
                if (current.length() > MIN_RUN_LENGTH) {
                    parts.add(current.toString());
                }
                current.setLength(0);
            }
        }
        if (current.length() > MIN_RUN_LENGTH) {
            parts.add(current.toString());
        }
        return String.join(" ", parts);
    }
}
