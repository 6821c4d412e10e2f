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
package dev.mars.tracelog.query;

/**
 * Who is asking. Tenant callers must name the tenant they read; administrative
 * callers may read across tenants.
 */
public enum CallerScope {
    TENANT,
    ADMINISTRATIVE;

    public boolean isAdministrative() {
        return this == ADMINISTRATIVE;
    }
}
