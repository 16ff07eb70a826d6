/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.dashboard.access.config;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

public class JdbcMetadataStore
        implements MetadataStore
{
    private static final Logger log = Logger.get(JdbcMetadataStore.class);

    static final String COLLABORATOR = "metadata store";

    private final JdbcConnectionFactory connectionFactory;
    private final int queryTimeoutSeconds;

    @Inject
    public JdbcMetadataStore(DashboardAccessConfig config, JdbcConnectionFactory connectionFactory)
    {
        this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory is null");
        this.queryTimeoutSeconds = (int) Math.max(1, config.getMetadataQueryTimeout().roundTo(SECONDS));
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> parameters)
    {
        try (Connection connection = connectionFactory.openConnection();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return readRows(resultSet);
            }
        }
        catch (SQLException e) {
            log.error(e, "Metadata query failed: %s", e.getMessage());
            throw new CollaboratorException(COLLABORATOR, "Query failed: " + e.getMessage(), e);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet resultSet)
            throws SQLException
    {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        ImmutableList.Builder<Map<String, Object>> rows = ImmutableList.builder();
        while (resultSet.next()) {
            // column values may be null
            Map<String, Object> row = new LinkedHashMap<>();
            for (int column = 1; column <= columnCount; column++) {
                row.put(metaData.getColumnLabel(column).toLowerCase(Locale.ENGLISH), resultSet.getObject(column));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return rows.build();
    }
}
