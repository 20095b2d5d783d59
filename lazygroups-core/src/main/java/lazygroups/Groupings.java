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
package lazygroups;

import java.util.Iterator;

import lazygroups.core.support.Assert;
import lazygroups.fn.KeyFunction;
import lazygroups.group.ChunksLazy;
import lazygroups.group.GroupByLazy;

/**
 * Static factories for lazy grouping and chunking.
 *
 * @since 1.0
 */
public abstract class Groupings {

	/**
	 * Group consecutive elements with equal keys.
	 *
	 * @param source      the elements, iterated once
	 * @param keyFunction the key of each element
	 * @param <K>         the key type
	 * @param <T>         the element type
	 * @return a new {@link GroupByLazy}
	 */
	public static <K, T> GroupByLazy<K, T> groupBy(Iterable<? extends T> source,
			KeyFunction<? super T, ? extends K> keyFunction) {
		Assert.notNull(source, "Source iterable cannot be null.");
		return new GroupByLazy<>(source.iterator(), keyFunction);
	}

	public static <K, T> GroupByLazy<K, T> groupBy(Iterator<? extends T> source,
			KeyFunction<? super T, ? extends K> keyFunction) {
		return new GroupByLazy<>(source, keyFunction);
	}

	/**
	 * Split into consecutive chunks of {@code size} elements, the last chunk holding the remainder.
	 *
	 * @param source the elements, iterated once
	 * @param size   the chunk size, strictly positive
	 * @param <T>    the element type
	 * @return a new {@link ChunksLazy}
	 */
	public static <T> ChunksLazy<T> chunks(Iterable<? extends T> source, int size) {
		Assert.notNull(source, "Source iterable cannot be null.");
		return new ChunksLazy<>(source.iterator(), size);
	}

	public static <T> ChunksLazy<T> chunks(Iterator<? extends T> source, int size) {
		return new ChunksLazy<>(source, size);
	}
}
