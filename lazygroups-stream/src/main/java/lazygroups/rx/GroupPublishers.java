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
package lazygroups.rx;

import lazygroups.core.support.Assert;
import lazygroups.group.Chunk;
import lazygroups.group.ChunksLazy;
import lazygroups.group.Group;
import lazygroups.group.GroupByLazy;
import lazygroups.group.GroupCursor;
import lazygroups.rx.stream.IteratorPublisher;
import org.reactivestreams.Publisher;

/**
 * Expose lazy groups and chunks as Reactive Streams {@link Publisher}s.
 * <p>
 * All signals happen synchronously on the thread requesting demand. Each outer publisher reads a fresh view of its
 * container. Cancelling the publisher of a group closes that group, so a group subscribed and cancelled early is
 * skipped rather than buffered.
 * <pre>
 * {@code
 * GroupPublishers.groups(Groupings.groupBy(lines, line -> line.charAt(0)))
 *     .subscribe(groupSubscriber);
 * }
 * </pre>
 *
 * @since 1.0
 */
public abstract class GroupPublishers {

	/**
	 * @param groupBy the container to read groups from
	 * @param <K>     the key type
	 * @param <T>     the element type
	 * @return a single-subscriber {@link Publisher} of the next groups of {@code groupBy}
	 */
	public static <K, T> Publisher<Group<K, T>> groups(GroupByLazy<K, T> groupBy) {
		Assert.notNull(groupBy, "GroupByLazy cannot be null.");
		return new IteratorPublisher<>(groupBy.iterator());
	}

	/**
	 * @param chunks the container to read chunks from
	 * @param <T>    the element type
	 * @return a single-subscriber {@link Publisher} of the next chunks of {@code chunks}
	 */
	public static <T> Publisher<Chunk<T>> chunks(ChunksLazy<T> chunks) {
		Assert.notNull(chunks, "ChunksLazy cannot be null.");
		return new IteratorPublisher<>(chunks.iterator());
	}

	/**
	 * @param group a group or chunk
	 * @param <T>   the element type
	 * @return a single-subscriber {@link Publisher} of the remaining elements of {@code group}, closing the group on
	 * cancel
	 */
	public static <T> Publisher<T> elements(GroupCursor<T> group) {
		Assert.notNull(group, "Group cannot be null.");
		return new IteratorPublisher<>(group);
	}
}
