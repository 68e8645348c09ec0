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

import java.util.ArrayList;
import java.util.List;

/// Joins onto every position where an axis was set or a channel was read.
///
/// No value is dropped. Axes are carried forward and channels masked where absent.
public class AxisOrChannelPositionsJoin extends Join {

    public AxisOrChannelPositionsJoin() {
    }

    public AxisOrChannelPositionsJoin(EveFile evefile) {
        super(evefile);
    }

    @Override
    public JoinMode mode() {
        return JoinMode.AXIS_OR_CHANNEL_POSITIONS;
    }

    @Override
    protected long[] commonPositions(List<long[]> axisPositions, List<long[]> channelPositions) {
        List<long[]> all = new ArrayList<>(axisPositions);
        all.addAll(channelPositions);
        return Positions.union(all);
    }
}
