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
 * A window of at most {@code size} consecutive source elements; only the last chunk can be shorter.
 *
 * @param <T> the element type
 * @since 1.0
 */
public final class Chunk<T> extends GroupCursor<T> {

	Chunk(GroupEngine<Long, T> engine, long index, T first) {
		super(engine, index, first);
	}

	@Override
	public String toString() {
		return "Chunk{index=" + index + '}';
	}
}
