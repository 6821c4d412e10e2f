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
package dev.mars.tracelog;

/**
 * Root of the unchecked exception hierarchy thrown by the investigation store.
 * <p>
 * Nothing thrown from this library is fatal to the hosting process: callers can
 * catch this type to degrade (stop persisting, keep serving reads) instead of crashing.
 */
public class TracelogException extends RuntimeException {

    public TracelogException(String message) {
        super(message);
    }

    public TracelogException(String message, Throwable cause) {
        super(message, cause);
    }
}
