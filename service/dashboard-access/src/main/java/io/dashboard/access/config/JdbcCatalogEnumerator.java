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
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.authz.CatalogEnumerator;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Lists catalogs and schemas through JDBC {@link java.sql.DatabaseMetaData}.
 */
public class JdbcCatalogEnumerator
        implements CatalogEnumerator
{
    static final String COLLABORATOR = "catalog enumerator";

    private final JdbcConnectionFactory connectionFactory;

    @Inject
    public JdbcCatalogEnumerator(JdbcConnectionFactory connectionFactory)
    {
        this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory is null");
    }

    @Override
    public List<String> listCatalogs()
    {
        try (Connection connection = connectionFactory.openConnection();
                ResultSet catalogs = connection.getMetaData().getCatalogs()) {
            return readColumn(catalogs, "TABLE_CAT");
        }
        catch (SQLException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to list catalogs: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listSchemas(String catalog)
    {
        try (Connection connection = connectionFactory.openConnection();
                ResultSet schemas = connection.getMetaData().getSchemas(catalog, null)) {
            return readColumn(schemas, "TABLE_SCHEM");
        }
        catch (SQLException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to list schemas in " + catalog + ": " + e.getMessage(), e);
        }
    }

    private static List<String> readColumn(ResultSet resultSet, String column)
            throws SQLException
    {
        ImmutableList.Builder<String> values = ImmutableList.builder();
        while (resultSet.next()) {
            values.add(resultSet.getString(column));
        }
        return values.build();
    }
}
