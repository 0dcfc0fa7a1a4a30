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

import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
@Warmup(time = 10, timeUnit = TimeUnit.SECONDS, iterations = 1)
@Measurement(time = 10, timeUnit = TimeUnit.SECONDS, iterations = 1)
@Fork(1)
public class InternerBenchmark {
    @Param({"1000", "100000"})
    private int numberOfValues;

    @Param
    private ReferenceCountMode referenceCountMode;

    private TextInterner interner;
    private String[] values;
    private StringBuilder lookupBuffer;
    private int index;

    @Setup(Level.Trial)
    public void setup() {
        InternerConfig config = new InternerConfig();
        config.setReferenceCountMode(referenceCountMode);
        interner = new TextInterner(config);
        values = new String[numberOfValues];
        for (int i = 0; i < numberOfValues; i++) {
            values[i] = "persistent://public/default/topic-" + i;
            interner.intern(values[i]);
        }
        lookupBuffer = new StringBuilder();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        interner.close();
    }

    private String nextValue() {
        String value = values[index];
        index = (index + 1) % numberOfValues;
        return value;
    }

    @Threads(1)
    @Benchmark
    public boolean tryInternHit() {
        lookupBuffer.setLength(0);
        lookupBuffer.append(nextValue());
        InternedRef<String> ref = interner.tryIntern(lookupBuffer).get();
        return ref.release();
    }

    @Threads(1)
    @Benchmark
    public boolean internHit() {
        return interner.intern(nextValue()).release();
    }

    @Threads(1)
    @Benchmark
    public int internMissAndCompact() {
        String value = nextValue();
        interner.intern(value + "-miss").release();
        if (index == 0) {
            return interner.compact();
        }
        return 0;
    }
}
