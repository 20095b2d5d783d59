/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package lazygroups.group;

import java.util.Iterator;

import lazygroups.core.support.Assert;
import lazygroups.core.support.Configuration;
import lazygroups.fn.ChunkIndex;

/**
 * Lazy split of a source into consecutive chunks of {@code size} elements. Behaves like {@link GroupByLazy} : views
 * returned by {@link #iterator()} share one counter, and chunks are only buffered when several of them are read at
 * the same time.
 *
 * @param <T> the element type
 * @since 1.0
 */
public final class ChunksLazy<T> implements Iterable<Chunk<T>> {

	final GroupEngine<Long, T> engine;

	private final int size;

	private long index;

	public ChunksLazy(Iterator<? extends T> source, int size) {
		this(source, size, Configuration.COMPACTION_DIVISOR);
	}

	public ChunksLazy(Iterator<? extends T> source, int size, int compactionDivisor) {
		Assert.notNull(source, "Source iterator cannot be null.");
		this.size = Assert.positive(size, "Chunk size");
		this.engine = new GroupEngine<>(source, new ChunkIndex(size), compactionDivisor);
	}

	@Override
	public Chunks<T> iterator() {
		return new Chunks<>(this);
	}

	public int size() {
		return size;
	}

	/**
	 * @return the number of source elements currently buffered for chunks read out of order
	 */
	public long pending() {
		return engine.pending();
	}

	long nextIndex() {
		return index++;
	}

	@Override
	public String toString() {
		return "ChunksLazy{size=" + size + ", nextIndex=" + index + ", " + engine + '}';
	}
}
