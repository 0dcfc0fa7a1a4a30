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
/**
 * Reference counted interning of immutable values.
 *
 * <p/>An {@link org.apache.pulsar.interner.Interner} deduplicates equal values behind shared
 * {@link org.apache.pulsar.interner.InternedRef handles}, so that they can be compared by identity.
 * {@link org.apache.pulsar.interner.SliceInterner} and {@link org.apache.pulsar.interner.TextInterner} accept
 * borrowed sequences and char sequences, copying them only when they are seen for the first time.
 */
package org.apache.pulsar.interner;
