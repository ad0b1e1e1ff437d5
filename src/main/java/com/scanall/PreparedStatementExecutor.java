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
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link StatementExecutor} backed by a caller-owned JDBC {@link PreparedStatement}.
 * <p>
 * Each call clears the statement's parameters, binds the new ones positionally and runs
 * {@link PreparedStatement#executeQuery()}. The statement itself is never closed here: preparing, timing out and
 * closing it is up to the caller.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class PreparedStatementExecutor implements StatementExecutor {
	@NonNull
	private final PreparedStatement preparedStatement;

	private PreparedStatementExecutor(@NonNull PreparedStatement preparedStatement) {
		requireNonNull(preparedStatement);
		this.preparedStatement = preparedStatement;
	}

	/**
	 * Acquires an executor for the given prepared statement.
	 *
	 * @param preparedStatement the statement to run
	 * @return an executor for {@code preparedStatement}
	 */
	@NonNull
	public static PreparedStatementExecutor forPreparedStatement(@NonNull PreparedStatement preparedStatement) {
		requireNonNull(preparedStatement);
		return new PreparedStatementExecutor(preparedStatement);
	}

	@NonNull
	@Override
	public RowCursor execute(@NonNull List<@Nullable Object> parameters) {
		requireNonNull(parameters);

		try {
			getPreparedStatement().clearParameters();

			for (int i = 0; i < parameters.size(); ++i)
				bindParameter(i + 1, unwrapOptionalValue(parameters.get(i)));

			ResultSet resultSet = getPreparedStatement().executeQuery();

			if (resultSet == null)
				throw new StatementExecutionException("Statement did not produce a result set");

			return ResultSetRowCursor.forResultSet(resultSet);
		} catch (SQLException e) {
			throw new StatementExecutionException(format("Unable to execute query with %d parameter[s]", parameters.size()), e);
		}
	}

	private void bindParameter(int parameterIndex,
														 @Nullable Object parameter) throws SQLException {
		if (parameter != null) {
			getPreparedStatement().setObject(parameterIndex, parameter);
			return;
		}

		try {
			ParameterMetaData parameterMetaData = getPreparedStatement().getParameterMetaData();

			if (parameterMetaData != null)
				getPreparedStatement().setNull(parameterIndex, parameterMetaData.getParameterType(parameterIndex));
			else
				getPreparedStatement().setNull(parameterIndex, Types.NULL);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			getPreparedStatement().setNull(parameterIndex, Types.NULL);
		}
	}

	@Nullable
	private static Object unwrapOptionalValue(@Nullable Object value) {
		if (value instanceof Optional<?>)
			return ((Optional<?>) value).orElse(null);

		return value;
	}

	@Override
	public String toString() {
		return format("%s{preparedStatement=%s}", getClass().getSimpleName(), getPreparedStatement());
	}

	@NonNull
	private PreparedStatement getPreparedStatement() {
		return this.preparedStatement;
	}
}
