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

import io.evefile.data.h5.H5Source;
import io.evefile.data.h5.RawColumns;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads columns of one dataset in a file and assigns them to fields of a data sequence.
///
/// The mapping goes from column ordinal within the dataset to the field it fills, for
/// example `{0: INDEX, 1: DATA}` for a plain position/value dataset.
public final class DataImporter implements DataLoader {

    private static final Logger logger = LogManager.getLogger(DataImporter.class);

    private final H5Source source;
    private final String path;
    private final Map<Integer, DataField> mapping;

    public DataImporter(H5Source source, String path, Map<Integer, DataField> mapping) {
        if (source == null) {
            throw new IllegalArgumentException("Need a source to import from");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Need a dataset path to import from");
        }
        if (mapping == null || mapping.isEmpty()) {
            throw new IllegalArgumentException("Need a column mapping for " + path);
        }
        this.source = source;
        this.path = path;
        this.mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    public String getPath() {
        return path;
    }

    public Map<Integer, DataField> getMapping() {
        return mapping;
    }

    public String getSourceName() {
        return source.filename();
    }

    @Override
    public Map<DataField, Object> load() {
        logger.debug("Importing {} from {}", mapping, path);
        RawColumns columns = source.read(path);
        Map<DataField, Object> fields = new EnumMap<>(DataField.class);
        mapping.forEach((ordinal, field) -> fields.put(field, columns.column(ordinal)));
        return fields;
    }

    @Override
    public String toString() {
        return source.filename() + ":" + path + " " + mapping;
    }
}
