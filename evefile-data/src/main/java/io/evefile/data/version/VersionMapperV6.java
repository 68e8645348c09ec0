package io.evefile.data.version;

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

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/// Maps files of eveH5 version 6, which record start and end as ISO timestamps.
public class VersionMapperV6 extends VersionMapperV5 {

    @Override
    public int version() {
        return 6;
    }

    @Override
    protected void mapFileMetadata() {
        super.mapFileMetadata();
        Map<String, String> root = source.attributes("/");
        destination.metadata().setStart(isoTimestamp(root, "StartTimeISO"));
        destination.metadata().setEnd(isoTimestamp(root, "EndTimeISO"));
    }

    private LocalDateTime isoTimestamp(Map<String, String> attributes, String name) {
        String value = attributes.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing root attribute " + name + " in " + source.filename());
        }
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + " '" + value + "' in " + source.filename(), e);
        }
    }
}
