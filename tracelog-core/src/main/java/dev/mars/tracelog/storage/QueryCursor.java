/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.tracelog.storage;

import dev.mars.tracelog.model.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque pagination token.
 * <p>
 * Wraps the append sequence of the last record returned; the next page continues
 * with strictly older records, so appends between pages never shift results.
 */
public final class QueryCursor {

    private static final String PREFIX = "seq:";

    private QueryCursor() {
    }

    static String encode(long sequence) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((PREFIX + sequence).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the sequence to continue below, or {@link Long#MAX_VALUE} for a null/blank cursor
     * @throws ValidationException if the token is malformed
     */
    static long decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return Long.MAX_VALUE;
        }
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
            if (!raw.startsWith(PREFIX)) {
                throw new ValidationException("malformed cursor");
            }
            long sequence = Long.parseLong(raw.substring(PREFIX.length()));
            if (sequence < 1) {
                throw new ValidationException("malformed cursor");
            }
            return sequence;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("malformed cursor");
        }
    }
}
