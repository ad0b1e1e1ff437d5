/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.scanall;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Contract for handling materialization log events.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface MaterializationLogger {
	/**
	 * Performs a logging operation on the given {@code materializationLog}.
	 * <p>
	 * Called once per materialization, after the cursor has been released. Implementors might choose to no-op, write to
	 * a logging framework, flag slow queries, and so on.
	 *
	 * @param materializationLog the event to log
	 */
	void log(@NonNull MaterializationLog materializationLog);
}
