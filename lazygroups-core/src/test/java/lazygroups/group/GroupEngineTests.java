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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import lazygroups.core.error.GroupingExceptions;
import lazygroups.fn.KeyFunction;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

public class GroupEngineTests {

	private static List<Integer> range(int count) {
		List<Integer> values = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			values.add(i);
		}
		return values;
	}

	private static <K, T> List<Group<K, T>> open(GroupByLazy<K, T> groupBy, int count) {
		Groups<K, T> groups = groupBy.iterator();
		List<Group<K, T>> opened = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			opened.add(groups.next());
		}
		return opened;
	}

	@Test
	public void drainedSlotsAreReleasedOnceHalfTheBufferIsEmpty() {
		GroupByLazy<Integer, Integer> groupBy = new GroupByLazy<>(range(10).iterator(), i -> i / 2, 2);
		GroupEngine<Integer, Integer> engine = groupBy.engine;

		List<Group<Integer, Integer>> opened = open(groupBy, 5);
		assertThat(engine.top(), is(4L));
		assertThat(engine.bufferSlots(), is(4));
		assertThat(engine.pending(), is(4L));

		assertThat(opened.get(0).toList(), contains(0, 1));
		assertThat("one drained slot out of four is kept", engine.bufferSlots(), is(4));
		assertThat(engine.bot(), is(1L));
		assertThat(engine.bufbot(), is(0L));

		assertThat(opened.get(1).toList(), contains(2, 3));
		assertThat(engine.bufferSlots(), is(2));
		assertThat(engine.bot(), is(2L));
		assertThat(engine.bufbot(), is(2L));

		assertThat(opened.get(4).toList(), contains(8, 9));
		assertThat(opened.get(3).toList(), contains(6, 7));
		assertThat(opened.get(2).toList(), contains(4, 5));
		assertThat(engine.bufferSlots(), is(0));
		assertThat(engine.pending(), is(0L));
	}

	@Test
	public void compactionDivisorTunesTheReleaseThreshold() {
		GroupByLazy<Integer, Integer> groupBy = new GroupByLazy<>(range(10).iterator(), i -> i / 2, 4);
		GroupEngine<Integer, Integer> engine = groupBy.engine;

		List<Group<Integer, Integer>> opened = open(groupBy, 5);
		assertThat(opened.get(0).toList(), contains(0, 1));

		assertThat(engine.bufferSlots(), is(3));
		assertThat(engine.bufbot(), is(1L));
	}

	@Test
	public void drainedGroupNeverSeesStaleData() {
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 1, 2).iterator(), KeyFunction.<Integer>identity(), 2);

		assertThat(engine.step(0), is((Object) 1));
		assertThat(engine.groupKey(0), is(1));
		assertThat(engine.step(1), is((Object) 2));

		assertThat(engine.step(0), is((Object) 1));
		assertThat(engine.step(0), sameInstance(GroupEngine.NONE));
		assertThat(engine.bot(), is(1L));
		assertThat(engine.step(0), sameInstance(GroupEngine.NONE));
	}

	@Test
	public void frontierGroupEndsWhenTheKeyChanges() {
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 1, 2).iterator(), KeyFunction.<Integer>identity(), 2);

		assertThat(engine.step(0), is((Object) 1));
		assertThat(engine.step(0), is((Object) 1));
		assertThat(engine.step(0), sameInstance(GroupEngine.NONE));
		assertThat("boundary crossed", engine.top(), is(1L));
		assertThat(engine.step(1), is((Object) 2));
		assertThat(engine.step(1), sameInstance(GroupEngine.NONE));
		assertThat(engine.isDone(), is(true));
		assertThat(engine.bufferSlots(), is(0));
	}

	@Test
	public void groupsCannotBeDiscoveredAheadOfTheFrontier() {
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 2, 3).iterator(), KeyFunction.<Integer>identity(), 2);
		assertThat(engine.step(0), is((Object) 1));

		try {
			engine.step(2);
			fail("expected group 2 to be out of range");
		}
		catch (IllegalStateException ise) {
			assertThat(ise, instanceOf(GroupingExceptions.GroupOutOfRange.class));
		}
		assertThat("state untouched", engine.top(), is(0L));
		assertThat(engine.step(1), is((Object) 2));
	}

	@Test
	public void keyIsOnlyAvailableRightAfterTheFirstElement() {
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 1, 2).iterator(), KeyFunction.<Integer>identity(), 2);

		try {
			engine.groupKey(0);
			fail("expected no key before the first element");
		}
		catch (IllegalStateException ise) {
			assertThat(ise, instanceOf(GroupingExceptions.KeyUnavailable.class));
		}

		engine.step(0);
		assertThat(engine.groupKey(0), is(1));
		try {
			engine.groupKey(0);
			fail("expected no key twice");
		}
		catch (IllegalStateException ise) {
			assertThat(ise, instanceOf(GroupingExceptions.KeyUnavailable.class));
		}
	}

	@Test
	public void failingKeyFunctionReleasesTheEngine() {
		AtomicBoolean fail = new AtomicBoolean(true);
		KeyFunction<Integer, Integer> failingOnce = element -> {
			if (element == 2 && fail.getAndSet(false)) {
				throw new IllegalArgumentException("boom");
			}
			return element;
		};
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 2, 3).iterator(), failingOnce, 2);

		engine.step(0);
		try {
			engine.groupKey(0);
			fail("expected the key function failure");
		}
		catch (IllegalArgumentException iae) {
			assertThat(iae.getMessage(), is("boom"));
		}

		engine.dropGroup(0);
		assertThat(engine.toString(), engine.isDone(), is(false));
	}

	@Test
	public void closedFrontierGroupIsWalkedWithoutBuffering() {
		GroupEngine<Integer, Integer> engine =
				new GroupEngine<>(Arrays.asList(1, 1, 1, 2).iterator(), KeyFunction.<Integer>identity(), 2);

		engine.step(0);
		engine.groupKey(0);
		engine.dropGroup(0);

		assertThat(engine.step(1), is((Object) 2));
		assertThat(engine.bufferSlots(), is(0));
		assertThat(engine.pending(), is(0L));
	}
}
