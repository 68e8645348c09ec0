package io.evefile.data.join;

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

import io.evefile.data.file.EveFile;

import java.util.List;

/// Joins onto the positions where both an axis was set and a channel was read.
///
/// The result is the intersection of the axis union with the channel union, so it is empty
/// when no axis or no channel is involved. Channel values may still be masked when several
/// channels were read at different positions.
public class AxisAndChannelPositionsJoin extends Join {

    public AxisAndChannelPositionsJoin() {
    }

    public AxisAndChannelPositionsJoin(EveFile evefile) {
        super(evefile);
    }

    @Override
    public JoinMode mode() {
        return JoinMode.AXIS_AND_CHANNEL_POSITIONS;
    }

    @Override
    protected long[] commonPositions(List<long[]> axisPositions, List<long[]> channelPositions) {
        return Positions.intersection(Positions.union(axisPositions), Positions.union(channelPositions));
    }
}
