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

/**
 * A run of consecutive source elements sharing the same key.
 *
 * @param <K> the key type
 * @param <T> the element type
 * @since 1.0
 */
public final class Group<K, T> extends GroupCursor<T> {

	private final K key;

	Group(GroupEngine<K, T> engine, long index, K key, T first) {
		super(engine, index, first);
		this.key = key;
	}

	public K key() {
		return key;
	}

	@Override
	public String toString() {
		return "Group{index=" + index + ", key=" + key + '}';
	}
}
