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

import com.google.inject.Inject;
import io.dashboard.access.DashboardAccessConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Opens connections to the SQL endpoint that serves configuration tables and
 * catalog metadata.
 */
public class JdbcConnectionFactory
{
    private final Optional<String> url;
    private final Optional<String> user;
    private final Optional<String> password;

    @Inject
    public JdbcConnectionFactory(DashboardAccessConfig config)
    {
        requireNonNull(config, "config is null");
        this.url = Optional.ofNullable(config.getMetadataJdbcUrl());
        this.user = config.getMetadataUser();
        this.password = config.getMetadataPassword();
    }

    public Connection openConnection()
            throws SQLException
    {
        if (url.isEmpty()) {
            throw new SQLException("metadata.jdbc-url is not configured");
        }
        if (user.isPresent()) {
            return DriverManager.getConnection(url.get(), user.get(), password.orElse(null));
        }
        return DriverManager.getConnection(url.get());
    }
}
