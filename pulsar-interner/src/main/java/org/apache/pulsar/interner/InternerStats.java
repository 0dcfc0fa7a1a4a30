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

import lombok.Value;

/**
 * Point in time snapshot of the counters of an interner.
 */
@Value
public class InternerStats {
    /** Number of entries in the table, including entries that would be removed by the next compaction. */
    int size;
    /** Lookups that found an existing handle. */
    long hitCount;
    /** Lookups that did not find an existing handle. */
    long missCount;
    /** New canonical values registered in the table. */
    long insertCount;
    /** Entries removed from the table by compactions. */
    long evictionCount;
    long compactionCount;
}
