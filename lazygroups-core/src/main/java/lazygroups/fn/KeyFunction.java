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
package lazygroups.fn;

/**
 * Computes the grouping key of a source element. Implementations may keep state between calls : the engine calls
 * {@link #apply(Object)} exactly once per source element, in source order.
 *
 * @param <T> the source element type
 * @param <K> the key type, compared with {@link Object#equals(Object)}
 * @since 1.0
 */
public interface KeyFunction<T, K> {

	/**
	 * Compute the key of the next source element.
	 *
	 * @param element the element just pulled from the source, may be {@literal null}
	 * @return the element key, may be {@literal null}
	 */
	K apply(T element);

	/**
	 * @param <T> the element type
	 * @return a {@link KeyFunction} using each element as its own key
	 */
	@SuppressWarnings("unchecked")
	static <T> KeyFunction<T, T> identity() {
		return (KeyFunction<T, T>) Identity.INSTANCE;
	}

	enum Identity implements KeyFunction<Object, Object> {
		INSTANCE;

		@Override
		public Object apply(Object element) {
			return element;
		}
	}
}
