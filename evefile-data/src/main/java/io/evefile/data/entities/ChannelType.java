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

import java.util.ArrayList;
import java.util.List;

/// How a channel acquires its value at each position.
public enum ChannelType {

    /// One reading per position.
    SINGLE_POINT,

    /// The mean of several readings, possibly repeated until they agree within a limit.
    AVERAGE,

    /// The mean of readings taken at a fixed trigger interval, with spread and count.
    INTERVAL;

    /// List the columns a channel of this type carries.
    /// @param normalized whether the channel was recorded with a normalizing channel
    /// @return the fields besides the index, in display order
    public List<DataField> fields(boolean normalized) {
        List<DataField> fields = new ArrayList<>();
        fields.add(DataField.DATA);
        switch (this) {
            case AVERAGE:
                fields.add(DataField.ATTEMPTS);
                break;
            case INTERVAL:
                fields.add(DataField.COUNTS);
                fields.add(DataField.STD);
                break;
            default:
                break;
        }
        if (normalized) {
            fields.add(DataField.NORMALIZED_DATA);
            fields.add(DataField.NORMALIZING_DATA);
        }
        return fields;
    }
}
