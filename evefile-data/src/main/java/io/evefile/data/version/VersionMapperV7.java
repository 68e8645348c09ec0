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

/// Maps files of eveH5 version 7, which flag simulated measurements.
public class VersionMapperV7 extends VersionMapperV6 {

    @Override
    public int version() {
        return 7;
    }

    @Override
    protected void mapFileMetadata() {
        super.mapFileMetadata();
        if ("yes".equals(source.attributes("/").get("Simulation"))) {
            destination.metadata().setSimulation(true);
        }
    }
}
