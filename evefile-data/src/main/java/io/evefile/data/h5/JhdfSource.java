package io.evefile.data.h5;

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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.jhdf.exceptions.HdfInvalidPathException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// An {@link H5Source} reading an HDF5 file with jhdf.
///
/// Access is serialized on this source, as one jhdf file handle is shared by all
/// deferred loaders of a measurement file.
public class JhdfSource implements H5Source {

    private static final Logger logger = LogManager.getLogger(JhdfSource.class);

    private final Path path;
    private final HdfFile file;
    private final AttributeDecoder decoder;

    /// Open a file for reading.
    /// @param path the HDF5 file
    /// @param decoder how to turn attributes into text
    /// @throws UncheckedIOException if the file cannot be opened as HDF5
    public JhdfSource(Path path, AttributeDecoder decoder) {
        this.path = path;
        this.decoder = decoder;
        try {
            this.file = new HdfFile(path);
        } catch (HdfException e) {
            throw new UncheckedIOException(new IOException("Cannot open " + path + " as HDF5: " + e.getMessage(), e));
        }
        logger.info("Opened {}", path);
    }

    public JhdfSource(Path path) {
        this(path, new AttributeDecoder());
    }

    @Override
    public String filename() {
        return path.toString();
    }

    @Override
    public synchronized boolean contains(String path) {
        try {
            node(path);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public synchronized boolean isGroup(String path) {
        return contains(path) && node(path).isGroup();
    }

    @Override
    public synchronized List<String> children(String groupPath) {
        Node node = node(groupPath);
        if (!node.isGroup()) {
            throw new IllegalArgumentException(groupPath + " in " + filename() + " is not a group");
        }
        return new ArrayList<>(((Group) node).getChildren().keySet());
    }

    @Override
    public synchronized Map<String, String> attributes(String path) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Attribute> entry : node(path).getAttributes().entrySet()) {
            attributes.put(entry.getKey(), decoder.decode(entry.getValue()));
        }
        return attributes;
    }

    @Override
    public synchronized RawColumns read(String path) {
        Node node = node(path);
        if (!(node instanceof Dataset)) {
            throw new IllegalArgumentException(path + " in " + filename() + " is not a dataset");
        }
        Dataset dataset = (Dataset) node;
        try {
            Object data = dataset.getData();
            if (data instanceof Map) {
                Map<String, Object> columns = new LinkedHashMap<>();
                ((Map<?, ?>) data).forEach((name, column) -> columns.put(String.valueOf(name), column));
                return RawColumns.of(columns);
            }
            return RawColumns.single(dataset.getName(), data);
        } catch (HdfException e) {
            throw new UncheckedIOException(new IOException("Cannot read " + path + " from " + filename(), e));
        }
    }

    private Node node(String path) {
        if ("/".equals(path)) {
            return file;
        }
        try {
            return file.getByPath(path);
        } catch (HdfInvalidPathException e) {
            throw new IllegalArgumentException("No node " + path + " in " + filename(), e);
        }
    }

    @Override
    public synchronized void close() {
        file.close();
        logger.info("Closed {}", path);
    }
}
