/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
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
package org.apache.pulsar.interner;

import lombok.Data;

/**
 * Configuration for an {@link Interner}.
 */
@Data
public class InternerConfig {

    /**
     * Reference counting used by the handles. {@link ReferenceCountMode#SHARED} handles can be passed to other
     * threads.
     */
    private ReferenceCountMode referenceCountMode = ReferenceCountMode.SHARED;

    /**
     * Initial capacity of the table.
     */
    private int initialCapacity = 16;

    /**
     * Whether the table storage is rebuilt to fit the remaining entries after a compaction removed some of them.
     */
    private boolean shrinkOnCompact = true;
}
