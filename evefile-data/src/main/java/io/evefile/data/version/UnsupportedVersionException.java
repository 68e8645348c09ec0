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

/// Thrown when no mapper knows the layout version of a file.
public class UnsupportedVersionException extends IllegalArgumentException {

    private final String version;

    public UnsupportedVersionException(String version) {
        super("No mapper for eveH5 version " + version);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
