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
 * Finds balanced top-level {@code {...}} spans in free text, honouring JSON
 * string quoting. Used on text recovered from binary storage where JSON
 * documents are embedded between unrelated bytes.
 */
public final class JsonObjectScanner {

    private static final int MAX_OBJECT_LENGTH = 5_000_000;

    private JsonObjectScanner() {
    }

    public static List<String> findObjects(String text) {
        List<String> objects = new ArrayList<>();
        int length = text.length();
        int index = 0;
        while (index < length) {
            int start = text.indexOf('{', index);
            if (start < 0) {
                break;
            }
            int end = findClosingBrace(text, start);
            if (end < 0) {
                index = start + 1;
                continue;
            }
            objects.add(text.substring(start, end + 1));
            index = end + 1;
        }
        return objects;
    }

    private static int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        int limit = Math.min(text.length(), start + MAX_OBJECT_LENGTH);
        for (int i = start; i < limit; i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
