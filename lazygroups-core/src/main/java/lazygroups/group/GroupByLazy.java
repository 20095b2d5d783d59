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
import lazygroups.fn.KeyFunction;

/**
 * Lazy grouping of consecutive source elements by key.
 * <p>
 * This is not an iterator itself : each call to {@link #iterator()} returns a new {@link Groups} view, and all views
 * share the source and a single group counter so that the groups they hand out never overlap. Any number of groups
 * may be read at the same time and in any order. Nothing is buffered while groups are read in order, or when each
 * group is closed before the next one is opened; a group that is neither drained nor closed when a later group is
 * opened gets its remaining elements buffered.
 * <pre>
 * {@code
 * GroupByLazy<Integer, Integer> groups = Groupings.groupBy(Arrays.asList(1, 1, 2, 2, 2, 3), KeyFunction.identity());
 * for (Group<Integer, Integer> group : groups) {
 *     try (Group<Integer, Integer> g = group) {
 *         System.out.println(g.key() + " -> " + g.toList());
 *     }
 * }
 * }
 * </pre>
 *
 * @param <K> the key type
 * @param <T> the element type
 * @since 1.0
 */
public final class GroupByLazy<K, T> implements Iterable<Group<K, T>> {

	final GroupEngine<K, T> engine;

	private long index;

	public GroupByLazy(Iterator<? extends T> source, KeyFunction<? super T, ? extends K> keyFunction) {
		this(source, keyFunction, Configuration.COMPACTION_DIVISOR);
	}

	/**
	 * @param source            the elements to group, read once
	 * @param keyFunction       computes each element key
	 * @param compactionDivisor drained buffer slots are released once they make up {@code 1/compactionDivisor} of the
	 *                          buffer
	 */
	public GroupByLazy(Iterator<? extends T> source,
			KeyFunction<? super T, ? extends K> keyFunction,
			int compactionDivisor) {
		Assert.notNull(source, "Source iterator cannot be null.");
		Assert.notNull(keyFunction, "Key function cannot be null.");
		this.engine = new GroupEngine<>(source, keyFunction, compactionDivisor);
	}

	@Override
	public Groups<K, T> iterator() {
		return new Groups<>(this);
	}

	/**
	 * @return the number of source elements currently buffered for groups read out of order
	 */
	public long pending() {
		return engine.pending();
	}

	long nextIndex() {
		return index++;
	}

	@Override
	public String toString() {
		return "GroupByLazy{nextIndex=" + index + ", " + engine + '}';
	}
}
