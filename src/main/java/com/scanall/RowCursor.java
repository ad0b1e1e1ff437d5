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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Optional;

/**
 * Forward-only, single-pass handle over the rows produced by one {@link StatementExecutor#execute(List)} call.
 * <p>
 * A cursor must not be advanced from more than one call site. {@link RowMaterializer} closes every cursor it acquires
 * exactly once.
 * <p>
 * {@link ResultSetRowCursor} is the JDBC implementation.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public interface RowCursor extends AutoCloseable {
	/**
	 * Moves to the next row.
	 * <p>
	 * Faults discovered while advancing are not thrown here; they end iteration and are reported by
	 * {@link #terminalError()}.
	 *
	 * @return {@code true} if a row is available, {@code false} once the rows are exhausted
	 */
	boolean advance();

	/**
	 * Writes the current row's columns into {@code targets}, positionally.
	 *
	 * @param targets one write target per column, in column order
	 * @throws RowScanException if the row could not be written into {@code targets}
	 */
	void scanInto(@NonNull List<@NonNull WriteTarget<?>> targets);

	/**
	 * Any deferred error encountered during iteration, checked once {@link #advance()} has returned {@code false}.
	 *
	 * @return the terminal error, or {@link Optional#empty()} if iteration ended normally
	 */
	@NonNull
	Optional<TerminalCursorException> terminalError();

	/**
	 * Releases the resources held by this cursor.
	 *
	 * @throws CursorReleaseException if the resources could not be released
	 */
	@Override
	void close();
}
