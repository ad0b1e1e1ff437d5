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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A fault a {@link RowCursor} only discovered once it ran out of rows, e.g. a stream-level transport failure.
 * <p>
 * Every row delivered before the fault is already in the accumulator.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TerminalCursorException extends DatabaseException {
	public TerminalCursorException(@Nullable String message) {
		super(message);
	}

	public TerminalCursorException(@Nullable Throwable cause) {
		super(cause);
	}

	public TerminalCursorException(@Nullable String message,
																 @Nullable Throwable cause) {
		super(message, cause);
	}
}
