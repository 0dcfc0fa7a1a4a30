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

import com.google.common.base.Equivalence;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Interner for text, handed out as {@link String strings}.
 *
 * <p/>Lookups accept any {@link CharSequence} and compare it by content, so a {@link StringBuilder} or a
 * {@link java.nio.CharBuffer} can be matched against the interned strings without building a new string. A string is
 * only created the first time an equal text is interned.
 */
public class TextInterner implements AutoCloseable {

    private final Interner<String> interner;

    public TextInterner() {
        this(new InternerConfig());
    }

    public TextInterner(InternerConfig config) {
        this.interner = new Interner<>(config, ContentEquivalence.INSTANCE);
    }

    public static TextInterner newLocalInterner() {
        return new TextInterner(Interner.configFor(ReferenceCountMode.LOCAL));
    }

    public static TextInterner newSharedInterner() {
        return new TextInterner(Interner.configFor(ReferenceCountMode.SHARED));
    }

    public Optional<InternedRef<String>> tryIntern(CharSequence text) {
        return interner.tryInternKey(checkText(text));
    }

    /**
     * Intern a borrowed text. It is converted to a string only if no equal text is interned; a {@link String} is
     * adopted as it is.
     */
    public InternedRef<String> intern(CharSequence text) {
        return interner.internKey(checkText(text), text::toString);
    }

    /**
     * Intern a string owned by the caller.
     */
    public InternedRef<String> internOwned(String text) {
        return interner.intern(text);
    }

    public boolean contains(CharSequence text) {
        return interner.containsKey(checkText(text));
    }

    private static CharSequence checkText(CharSequence text) {
        return Objects.requireNonNull(text, "text");
    }

    /**
     * @see Interner#compact()
     */
    public int compact() {
        return interner.compact();
    }

    public int clear() {
        return interner.clear();
    }

    @Override
    public void close() {
        interner.close();
    }

    public int size() {
        return interner.size();
    }

    public boolean isEmpty() {
        return interner.isEmpty();
    }

    public ReferenceCountMode getReferenceCountMode() {
        return interner.getReferenceCountMode();
    }

    public InternerStats getStats() {
        return interner.getStats();
    }

    @Override
    public String toString() {
        return "TextInterner{referenceCountMode=" + getReferenceCountMode() + ", size=" + size() + "}";
    }

    /**
     * Compares char sequences by content. The hash is the one of {@link String#hashCode()}, so a string and any other
     * sequence with the same chars hash the same.
     */
    static final class ContentEquivalence extends Equivalence<CharSequence> {
        static final ContentEquivalence INSTANCE = new ContentEquivalence();

        private ContentEquivalence() {
        }

        @Override
        protected boolean doEquivalent(CharSequence a, CharSequence b) {
            return StringUtils.equals(a, b);
        }

        @Override
        protected int doHash(CharSequence text) {
            if (text instanceof String) {
                return text.hashCode();
            }
            int hash = 0;
            for (int i = 0; i < text.length(); i++) {
                hash = 31 * hash + text.charAt(i);
            }
            return hash;
        }
    }
}
