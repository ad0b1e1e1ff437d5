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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link RowCursor} over a JDBC {@link ResultSet}.
 * <p>
 * Column values are read with {@link ResultSet#getObject(int, Class)} using each target's type, so conversion rules are
 * the driver's. Targets should use wrapper types ({@code Integer}, not {@code int}). A target of type {@code Object}
 * receives whatever {@link ResultSet#getObject(int)} returns.
 * <p>
 * An {@link SQLException} thrown while moving to the next row ends iteration and is reported through
 * {@link #terminalError()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class ResultSetRowCursor implements RowCursor {
	@NonNull
	private final ResultSet resultSet;
	@Nullable
	private Integer columnCount;
	@Nullable
	private TerminalCursorException terminalError;
	private long rowNumber;
	private boolean exhausted;
	private boolean closed;

	private ResultSetRowCursor(@NonNull ResultSet resultSet) {
		requireNonNull(resultSet);
		this.resultSet = resultSet;
	}

	/**
	 * Acquires a cursor over the given result set. Closing the cursor closes {@code resultSet}.
	 *
	 * @param resultSet the rows to walk
	 * @return a cursor over {@code resultSet}
	 */
	@NonNull
	public static ResultSetRowCursor forResultSet(@NonNull ResultSet resultSet) {
		requireNonNull(resultSet);
		return new ResultSetRowCursor(resultSet);
	}

	@Override
	public boolean advance() {
		if (this.closed || this.exhausted)
			return false;

		try {
			if (getResultSet().next()) {
				++this.rowNumber;
				return true;
			}

			this.exhausted = true;
			return false;
		} catch (SQLException e) {
			this.exhausted = true;
			this.terminalError = new TerminalCursorException(format("Unable to advance past row %d", this.rowNumber), e);
			return false;
		}
	}

	@Override
	public void scanInto(@NonNull List<@NonNull WriteTarget<?>> targets) {
		requireNonNull(targets);

		if (this.closed)
			throw new IllegalStateException("Cursor is closed");

		if (this.rowNumber == 0 || this.exhausted)
			throw new IllegalStateException(format("Scan called without a current row; call %s#advance() first", RowCursor.class.getSimpleName()));

		int columnCount = getColumnCount();

		if (targets.size() != columnCount)
			throw new RowScanException(format("Expected %d destination arguments in scan, not %d", columnCount, targets.size()),
					this.rowNumber, null, null);

		for (int i = 0; i < targets.size(); ++i)
			scanColumn(i + 1, requireNonNull(targets.get(i)));
	}

	private <T> void scanColumn(int columnIndex,
															@NonNull WriteTarget<T> target) {
		requireNonNull(target);

		Class<T> type = target.getType();
		T value;

		try {
			Object rawValue = type == Object.class ? getResultSet().getObject(columnIndex) : getResultSet().getObject(columnIndex, type);
			value = rawValue == null || getResultSet().wasNull() ? null : type.cast(rawValue);
		} catch (SQLException | RuntimeException e) {
			throw new RowScanException(format("Unable to read column %d of row %d as %s", columnIndex, this.rowNumber, type.getName()),
					this.rowNumber, columnIndex, e);
		}

		if (value == null && !target.isNullable())
			throw new RowScanException(format("Converting NULL to %s is unsupported (column %d of row %d)", type.getName(), columnIndex, this.rowNumber),
					this.rowNumber, columnIndex, null);

		try {
			target.write(value);
		} catch (RuntimeException e) {
			throw new RowScanException(format("Unable to write column %d of row %d", columnIndex, this.rowNumber),
					this.rowNumber, columnIndex, e);
		}
	}

	@NonNull
	@Override
	public Optional<TerminalCursorException> terminalError() {
		return Optional.ofNullable(this.terminalError);
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		try {
			getResultSet().close();
		} catch (SQLException e) {
			throw new CursorReleaseException("Unable to close result set", e);
		}
	}

	@NonNull
	private Integer getColumnCount() {
		if (this.columnCount == null) {
			try {
				this.columnCount = getResultSet().getMetaData().getColumnCount();
			} catch (SQLException e) {
				throw new RowScanException("Unable to determine result set column count", this.rowNumber, null, e);
			}
		}

		return this.columnCount;
	}

	@NonNull
	private ResultSet getResultSet() {
		return this.resultSet;
	}
}
