package io.evefile.data.entities;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// The named columns a data sequence can carry besides its index.
public enum DataField {
    INDEX("index"),
    DATA("data"),
    ATTEMPTS("attempts"),
    COUNTS("counts"),
    STD("std"),
    NORMALIZED_DATA("normalized_data"),
    NORMALIZING_DATA("normalizing_data");

    private final String label;

    DataField(String label) {
        this.label = label;
    }

    /// @return the lower case column label used in tables and listings
    public String label() {
        return label;
    }
}
