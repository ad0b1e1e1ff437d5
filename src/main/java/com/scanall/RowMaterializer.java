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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Runs a query and scans every result row into a caller-owned {@link RecordSetAccumulator}.
 * <p>
 * Processing stops at the first failure. Rows scanned before the failure stay in the accumulator, as does the record
 * allocated for the failing row. The {@link RowCursor} is closed exactly once whenever the executor managed to hand
 * one back.
 * <pre>{@code  RowMaterializer rowMaterializer = RowMaterializer.withDefaultConfiguration();
 * Labels labels = new Labels();
 *
 * rowMaterializer.materializeAll(PreparedStatementExecutor.forPreparedStatement(selectLabelsByOwner), labels, ownerId);}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RowMaterializer {
	@NonNull
	private final MaterializationLogger materializationLogger;

	private RowMaterializer(@NonNull Builder builder) {
		requireNonNull(builder);
		this.materializationLogger = builder.materializationLogger == null ? (materializationLog) -> {} : builder.materializationLogger;
	}

	/**
	 * Acquires an instance with out-of-the-box defaults, which does no logging.
	 *
	 * @return a {@link RowMaterializer} with default configuration
	 */
	@NonNull
	public static RowMaterializer withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Acquires a builder, specifying where materialization diagnostics should go.
	 *
	 * @param materializationLogger receives one {@link MaterializationLog} per call
	 * @return a {@link RowMaterializer} builder
	 */
	@NonNull
	public static Builder withMaterializationLogger(@NonNull MaterializationLogger materializationLogger) {
		requireNonNull(materializationLogger);
		return new Builder().materializationLogger(materializationLogger);
	}

	/**
	 * Executes {@code statementExecutor} with the given bind arguments and appends one record per result row to
	 * {@code recordSetAccumulator}, in delivery order.
	 *
	 * @param statementExecutor    runs the query
	 * @param recordSetAccumulator receives the rows
	 * @param parameters           bind arguments, if any
	 * @return the number of rows scanned
	 * @throws StatementExecutionException if the query could not be started
	 * @throws RowScanException            if a row could not be scanned
	 * @throws TerminalCursorException     if the cursor reported a fault after its last row
	 * @throws CursorReleaseException      if releasing the cursor was the only failure
	 */
	@NonNull
	public Long materializeAll(@NonNull StatementExecutor statementExecutor,
														 @NonNull RecordSetAccumulator recordSetAccumulator,
														 Object @Nullable ... parameters) {
		requireNonNull(statementExecutor);
		requireNonNull(recordSetAccumulator);

		return materializeAll(statementExecutor, recordSetAccumulator, parameters == null ? List.of() : Arrays.asList(parameters));
	}

	/**
	 * Executes {@code statementExecutor} with the given bind arguments and appends one record per result row to
	 * {@code recordSetAccumulator}, in delivery order.
	 *
	 * @param statementExecutor    runs the query
	 * @param recordSetAccumulator receives the rows
	 * @param parameters           bind arguments, passed through to {@code statementExecutor} as-is, one list element per
	 *                             placeholder
	 * @return the number of rows scanned
	 * @throws StatementExecutionException if the query could not be started
	 * @throws RowScanException            if a row could not be scanned
	 * @throws TerminalCursorException     if the cursor reported a fault after its last row
	 * @throws CursorReleaseException      if releasing the cursor was the only failure
	 */
	@NonNull
	public Long materializeAll(@NonNull StatementExecutor statementExecutor,
														 @NonNull RecordSetAccumulator recordSetAccumulator,
														 @NonNull List<?> parameters) {
		requireNonNull(statementExecutor);
		requireNonNull(recordSetAccumulator);
		requireNonNull(parameters);

		List<@Nullable Object> parametersAsList = Collections.unmodifiableList(parameters);

		long startTime = nanoTime();
		Duration executionDuration = null;
		Duration scanDuration = null;
		long rowCount = 0;
		Exception exception = null;
		Throwable thrown = null;

		try {
			RowCursor rowCursor = statementExecutor.execute(parametersAsList);

			if (rowCursor == null)
				throw new IllegalStateException(format("%s returned a null %s", statementExecutor, RowCursor.class.getSimpleName()));

			executionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (rowCursor) {
				while (rowCursor.advance()) {
					SingleRecordBinder singleRecordBinder = recordSetAccumulator.newElement();

					if (singleRecordBinder == null)
						throw new IllegalStateException(format("%s returned a null %s", recordSetAccumulator, SingleRecordBinder.class.getSimpleName()));

					List<WriteTarget<?>> targets = singleRecordBinder.targets();

					if (targets == null)
						throw new IllegalStateException(format("%s returned null write targets", singleRecordBinder));

					for (int i = 0; i < targets.size(); ++i)
						if (targets.get(i) == null)
							throw new IllegalStateException(format("%s returned a null write target for column %d", singleRecordBinder, i + 1));

					rowCursor.scanInto(targets);
					++rowCount;
				}

				Optional<TerminalCursorException> terminalError = rowCursor.terminalError();

				if (terminalError.isPresent())
					throw terminalError.get();
			} finally {
				scanDuration = Duration.ofNanos(nanoTime() - startTime);
			}

			return rowCount;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} finally {
			MaterializationLog materializationLog = MaterializationLog.withStatementExecutor(statementExecutor)
					.parameters(parametersAsList)
					.executionDuration(executionDuration)
					.scanDuration(scanDuration)
					.rowCount(rowCount)
					.exception(exception)
					.build();

			try {
				getMaterializationLogger().log(materializationLog);
			} catch (RuntimeException | Error loggerFailure) {
				if (thrown != null)
					thrown.addSuppressed(loggerFailure);
				else
					throw loggerFailure;
			}
		}
	}

	@NonNull
	private MaterializationLogger getMaterializationLogger() {
		return this.materializationLogger;
	}

	/**
	 * Builder used to construct instances of {@link RowMaterializer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private MaterializationLogger materializationLogger;

		private Builder() {
			// Only permit construction through RowMaterializer static methods
		}

		@NonNull
		public Builder materializationLogger(@Nullable MaterializationLogger materializationLogger) {
			this.materializationLogger = materializationLogger;
			return this;
		}

		@NonNull
		public RowMaterializer build() {
			return new RowMaterializer(this);
		}
	}
}
