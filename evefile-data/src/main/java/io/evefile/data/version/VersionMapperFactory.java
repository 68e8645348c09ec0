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

import io.evefile.data.MissingDependencyException;
import io.evefile.data.h5.H5Source;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/// Chooses the {@link VersionMapper} for a file from its `EVEH5Version` root attribute.
///
/// Only the major version counts: `"7.1"` is handled by the mapper for version 7.
public class VersionMapperFactory {

    private static final Logger logger = LogManager.getLogger(VersionMapperFactory.class);

    public static final String VERSION_ATTRIBUTE = "EVEH5Version";

    private static final Map<Integer, Supplier<VersionMapper>> MAPPERS;

    static {
        Map<Integer, Supplier<VersionMapper>> mappers = new TreeMap<>();
        mappers.put(5, VersionMapperV5::new);
        mappers.put(6, VersionMapperV6::new);
        mappers.put(7, VersionMapperV7::new);
        MAPPERS = Collections.unmodifiableMap(mappers);
    }

    /// @return the major versions with a mapper
    public static Set<Integer> supportedVersions() {
        return MAPPERS.keySet();
    }

    /// @param source an opened file
    /// @return a mapper for the file's layout, with the source set
    /// @throws UnsupportedVersionException if the version is missing or unknown
    public VersionMapper getMapper(H5Source source) {
        if (source == null) {
            throw new MissingDependencyException("Need a source to determine the eveH5 version");
        }
        String version = source.attributes("/").getOrDefault(VERSION_ATTRIBUTE, "");
        Supplier<VersionMapper> supplier = MAPPERS.get(majorVersion(version));
        if (supplier == null) {
            UnsupportedVersionException exception = new UnsupportedVersionException(version);
            logger.error("{} in {}", exception.getMessage(), source.filename());
            throw exception;
        }
        VersionMapper mapper = supplier.get();
        mapper.setSource(source);
        logger.debug("Using {} for {} (version {})", mapper.getClass().getSimpleName(), source.filename(), version);
        return mapper;
    }

    static int majorVersion(String version) {
        String major = version.trim();
        int dot = major.indexOf('.');
        if (dot >= 0) {
            major = major.substring(0, dot);
        }
        try {
            return Integer.parseInt(major);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
