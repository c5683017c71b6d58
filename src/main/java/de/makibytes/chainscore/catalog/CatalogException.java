/*
 * Copyright (c) 2026 MakiBytes.
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
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.chainscore.catalog;

import java.util.List;

/**
 * Raised when the definition catalog cannot be read or fails validation.
 */
public class CatalogException extends RuntimeException {

    private final List<String> violations;

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public CatalogException(List<String> violations) {
        super("Invalid definition catalog: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
