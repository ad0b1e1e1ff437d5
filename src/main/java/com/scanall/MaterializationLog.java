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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for a single {@link RowMaterializer#materializeAll(StatementExecutor, RecordSetAccumulator, List)} call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class MaterializationLog {
	@NonNull
	private final String statementExecutorDescription;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration scanDuration;
	@NonNull
	private final Long rowCount;
	@Nullable
	private final Exception exception;

	private MaterializationLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statementExecutorDescription = requireNonNull(builder.statementExecutorDescription);
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.executionDuration = builder.executionDuration;
		this.scanDuration = builder.scanDuration;
		this.rowCount = builder.rowCount == null ? 0L : builder.rowCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.scanDuration != null)
			totalDuration = totalDuration.plus(this.scanDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link MaterializationLog} builder for the given {@code statementExecutor}.
	 *
	 * @param statementExecutor the executor whose results were materialized
	 * @return a {@link MaterializationLog} builder
	 */
	@NonNull
	public static Builder withStatementExecutor(@NonNull StatementExecutor statementExecutor) {
		requireNonNull(statementExecutor);
		return new Builder(String.valueOf(statementExecutor));
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("statementExecutor=%s", getStatementExecutorDescription()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		Duration executionDuration = getExecutionDuration().orElse(null);

		if (executionDuration != null)
			components.add(format("executionDuration=%s", executionDuration));

		Duration scanDuration = getScanDuration().orElse(null);

		if (scanDuration != null)
			components.add(format("scanDuration=%s", scanDuration));

		components.add(format("rowCount=%s", getRowCount()));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MaterializationLog))
			return false;

		MaterializationLog materializationLog = (MaterializationLog) object;

		return Objects.equals(getStatementExecutorDescription(), materializationLog.getStatementExecutorDescription())
				&& Objects.equals(getParameters(), materializationLog.getParameters())
				&& Objects.equals(getExecutionDuration(), materializationLog.getExecutionDuration())
				&& Objects.equals(getScanDuration(), materializationLog.getScanDuration())
				&& Objects.equals(getRowCount(), materializationLog.getRowCount())
				&& Objects.equals(getException(), materializationLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatementExecutorDescription(), getParameters(), getExecutionDuration(), getScanDuration(),
				getRowCount(), getException());
	}

	/**
	 * The {@code toString()} of the executor that ran the query.
	 *
	 * @return a description of the statement executor
	 */
	@NonNull
	public String getStatementExecutorDescription() {
		return this.statementExecutorDescription;
	}

	/**
	 * @return the bind arguments the query was run with
	 */
	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * How long did it take the {@link StatementExecutor} to hand back a {@link RowCursor}?
	 *
	 * @return how long it took to execute the statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to walk the cursor and scan every row, including releasing the cursor?
	 *
	 * @return how long it took to scan the rows, if available
	 */
	@NonNull
	public Optional<Duration> getScanDuration() {
		return Optional.ofNullable(this.scanDuration);
	}

	/**
	 * @return the sum of the execution and scan durations
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * How many rows were scanned successfully?
	 * <p>
	 * A record allocated for a row that then failed to scan is not counted.
	 *
	 * @return the number of successfully scanned rows
	 */
	@NonNull
	public Long getRowCount() {
		return this.rowCount;
	}

	/**
	 * @return the exception that ended the call, if any
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link MaterializationLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String statementExecutorDescription;
		@Nullable
		private List<@Nullable Object> parameters;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration scanDuration;
		@Nullable
		private Long rowCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull String statementExecutorDescription) {
			requireNonNull(statementExecutorDescription);
			this.statementExecutorDescription = statementExecutorDescription;
		}

		@NonNull
		public Builder parameters(@Nullable List<@Nullable Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder scanDuration(@Nullable Duration scanDuration) {
			this.scanDuration = scanDuration;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Long rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public MaterializationLog build() {
			return new MaterializationLog(this);
		}
	}
}
