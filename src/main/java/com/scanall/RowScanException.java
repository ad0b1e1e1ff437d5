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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by a {@link RowCursor} when the current row could not be written into its {@link WriteTarget}s, e.g. arity
 * mismatch, an incompatible value or a failed conversion.
 * <p>
 * The record for the failing row has already been appended to the accumulator by the time this is thrown, so callers
 * should expect an allocated but unpopulated record at the end of their collection.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class RowScanException extends DatabaseException {
	@NonNull
	private final Long rowNumber;
	@Nullable
	private final Integer columnIndex;

	/**
	 * @param message     a message describing this exception
	 * @param rowNumber   1-based number of the row that failed to scan
	 * @param columnIndex 1-based index of the offending column, or {@code null} if the failure is not column-specific
	 * @param cause       the cause of this exception, if any
	 */
	public RowScanException(@Nullable String message,
													@NonNull Long rowNumber,
													@Nullable Integer columnIndex,
													@Nullable Throwable cause) {
		super(message, cause);
		requireNonNull(rowNumber);

		this.rowNumber = rowNumber;
		this.columnIndex = columnIndex;
	}

	/**
	 * @return 1-based number of the row that failed to scan
	 */
	@NonNull
	public Long getRowNumber() {
		return this.rowNumber;
	}

	/**
	 * @return 1-based index of the offending column, or empty if the failure is not column-specific
	 */
	@NonNull
	public Optional<Integer> getColumnIndex() {
		return Optional.ofNullable(this.columnIndex);
	}
}
