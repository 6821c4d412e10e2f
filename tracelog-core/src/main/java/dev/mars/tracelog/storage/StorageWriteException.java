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

/**
 * An append, rotation or compaction could not be written. The log is left as it was
 * before the write and the store keeps serving reads.
 */
public class StorageWriteException extends StorageException {

    public StorageWriteException(String message) {
        super(message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
