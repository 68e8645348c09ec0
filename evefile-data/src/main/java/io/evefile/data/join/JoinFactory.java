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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/// Creates {@link Join} instances by mode, handing on the file they should resolve
/// names against.
public class JoinFactory {

    private static final Map<JoinMode, Function<EveFile, Join>> JOINS;

    static {
        Map<JoinMode, Function<EveFile, Join>> joins = new EnumMap<>(JoinMode.class);
        joins.put(JoinMode.CHANNEL_POSITIONS, ChannelPositionsJoin::new);
        joins.put(JoinMode.AXIS_POSITIONS, AxisPositionsJoin::new);
        joins.put(JoinMode.AXIS_AND_CHANNEL_POSITIONS, AxisAndChannelPositionsJoin::new);
        joins.put(JoinMode.AXIS_OR_CHANNEL_POSITIONS, AxisOrChannelPositionsJoin::new);
        JOINS = Collections.unmodifiableMap(joins);
    }

    private EveFile evefile;
    private JoinMode defaultMode = JoinMode.DEFAULT;

    public JoinFactory() {
    }

    public JoinFactory(EveFile evefile) {
        this.evefile = evefile;
    }

    public EveFile getEvefile() {
        return evefile;
    }

    public void setEvefile(EveFile evefile) {
        this.evefile = evefile;
    }

    public JoinMode getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(JoinMode defaultMode) {
        this.defaultMode = defaultMode == null ? JoinMode.DEFAULT : defaultMode;
    }

    /// @return a join of the default mode
    public Join getJoin() {
        return getJoin(defaultMode);
    }

    /// @param mode the join mode
    /// @return a new join bound to this factory's file
    public Join getJoin(JoinMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Need a join mode");
        }
        return JOINS.get(mode).apply(evefile);
    }

    /// @param mode any name {@link JoinMode#fromString(String)} accepts
    /// @return a new join bound to this factory's file
    /// @throws IllegalArgumentException if the mode is unknown
    public Join getJoin(String mode) {
        return getJoin(JoinMode.parse(mode));
    }
}
