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

import java.util.List;
import java.util.Map;

/// Read-only access to the nodes of an HDF5 file.
///
/// Paths are absolute and slash separated, with `/` naming the root group. The layout
/// mappers and data importers only see this interface, so a file can also be assembled in
/// memory.
public interface H5Source extends AutoCloseable {

    /// @return the name of the underlying file
    String filename();

    /// @param path an absolute node path
    /// @return true if a group or dataset exists at that path
    boolean contains(String path);

    /// @param path an absolute node path
    /// @return true if a group exists at that path
    boolean isGroup(String path);

    /// List the names of the direct children of a group, in file order.
    /// @param groupPath an absolute group path
    /// @return child names, without the group prefix
    /// @throws IllegalArgumentException if there is no group at that path
    List<String> children(String groupPath);

    /// Read the attributes of a node, decoded to text.
    /// @param path an absolute node path
    /// @return attribute names mapped to values, empty if the node has none
    /// @throws IllegalArgumentException if there is no node at that path
    Map<String, String> attributes(String path);

    /// Read a dataset into memory.
    /// @param path an absolute dataset path
    /// @return the dataset columns
    /// @throws IllegalArgumentException if there is no dataset at that path
    RawColumns read(String path);

    @Override
    void close();
}
