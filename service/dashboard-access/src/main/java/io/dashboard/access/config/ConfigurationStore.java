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

import com.google.common.cache.Cache;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Resolves named queries, filters, visualizations and system settings from the
 * configuration tables, and renders query templates into executable SQL.
 * <p>
 * Lookups are cached for a fixed time. Empty lookups are not cached, so a row
 * added to a configuration table becomes visible on the next request. Failures
 * of the metadata store propagate as {@link CollaboratorException}.
 */
public class ConfigurationStore
{
    private static final Logger log = Logger.get(ConfigurationStore.class);

    static final String DASHBOARD_QUERIES = "dashboard_queries";
    static final String FILTER_DEFINITIONS = "filter_definitions";
    static final String VISUALIZATION_CONFIGS = "visualization_configs";
    static final String DASHBOARD_TABS = "dashboard_tabs";
    static final String SYSTEM_CONFIG = "system_config";

    static final List<String> REQUIRED_TABLES = ImmutableList.of(
            DASHBOARD_QUERIES,
            FILTER_DEFINITIONS,
            VISUALIZATION_CONFIGS,
            DASHBOARD_TABS,
            SYSTEM_CONFIG);

    static final String CATALOG_PARAMETER = "catalog";
    static final String SCHEMA_PARAMETER = "schema";

    private final MetadataStore metadataStore;
    private final ConfigurationCache cache;
    private final Cache<String, QueryConfig> queryById;
    private final Cache<Optional<String>, List<QueryConfig>> queriesByCategory;
    private final Cache<FilterLookup, List<FilterConfig>> filtersByTypeAndTab;
    private final Cache<Optional<String>, List<VisualizationConfig>> visualizationsByTab;
    private final Cache<String, VisualizationConfig> visualizationById;
    private final Cache<String, Object> systemConfigByKey;
    private final String configCatalog;
    private final String configSchema;
    private final String dataCatalog;
    private final String dataSchema;

    @Inject
    public ConfigurationStore(DashboardAccessConfig config, MetadataStore metadataStore, ConfigurationCache cache)
    {
        requireNonNull(config, "config is null");
        this.metadataStore = requireNonNull(metadataStore, "metadataStore is null");
        this.cache = requireNonNull(cache, "cache is null");
        this.queryById = cache.newLookup();
        this.queriesByCategory = cache.newLookup();
        this.filtersByTypeAndTab = cache.newLookup();
        this.visualizationsByTab = cache.newLookup();
        this.visualizationById = cache.newLookup();
        this.systemConfigByKey = cache.newLookup();
        this.configCatalog = config.getMetadataCatalog();
        this.configSchema = config.getMetadataSchema();
        this.dataCatalog = config.getDataCatalog();
        this.dataSchema = config.getDataSchema();
    }

    public Optional<QueryConfig> getQueryConfig(String queryId)
    {
        requireNonNull(queryId, "queryId is null");
        QueryConfig cached = queryById.getIfPresent(queryId);
        if (cached != null) {
            return Optional.of(cached);
        }

        List<Map<String, Object>> rows = metadataStore.query(
                "SELECT * FROM " + tableName(DASHBOARD_QUERIES) + " WHERE id = ? AND is_active = true",
                ImmutableList.of(queryId));
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        QueryConfig queryConfig = ConfigRowMapper.toQueryConfig(rows.get(0));
        queryById.put(queryId, queryConfig);
        return Optional.of(queryConfig);
    }

    /**
     * Returns the active queries ordered by name, optionally limited to one category.
     */
    public List<QueryConfig> getAllQueries(Optional<String> category)
    {
        List<QueryConfig> cached = queriesByCategory.getIfPresent(category);
        if (cached != null) {
            return cached;
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName(DASHBOARD_QUERIES)).append(" WHERE is_active = true");
        List<Object> parameters = new ArrayList<>();
        if (category.isPresent()) {
            sql.append(" AND category = ?");
            parameters.add(category.get());
        }
        sql.append(" ORDER BY name");

        List<QueryConfig> queries = metadataStore.query(sql.toString(), parameters).stream()
                .map(ConfigRowMapper::toQueryConfig)
                .collect(toImmutableList());
        cacheIfNotEmpty(queriesByCategory, category, queries);
        return queries;
    }

    /**
     * Returns the active filters ordered by display order and name. When a tab is
     * given only filters listing it in {@code applies_to_tabs} are returned.
     */
    public List<FilterConfig> getFilterConfigs(Optional<String> filterType, Optional<String> tab)
    {
        FilterLookup lookup = new FilterLookup(filterType, tab);
        List<FilterConfig> cached = filtersByTypeAndTab.getIfPresent(lookup);
        if (cached != null) {
            return cached;
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName(FILTER_DEFINITIONS)).append(" WHERE is_active = true");
        List<Object> parameters = new ArrayList<>();
        if (filterType.isPresent()) {
            sql.append(" AND filter_type = ?");
            parameters.add(filterType.get());
        }
        sql.append(" ORDER BY display_order, filter_name");

        List<FilterConfig> filters = metadataStore.query(sql.toString(), parameters).stream()
                .map(ConfigRowMapper::toFilterConfig)
                .filter(filter -> tab.isEmpty() || filter.appliesToTab(tab.get()))
                .collect(toImmutableList());
        cacheIfNotEmpty(filtersByTypeAndTab, lookup, filters);
        return filters;
    }

    /**
     * Returns the active visualizations ordered by display order and name. When a
     * tab is given only visualizations defaulting to it are returned.
     */
    public List<VisualizationConfig> getVizConfigs(Optional<String> tab)
    {
        List<VisualizationConfig> cached = visualizationsByTab.getIfPresent(tab);
        if (cached != null) {
            return cached;
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName(VISUALIZATION_CONFIGS)).append(" WHERE is_active = true");
        List<Object> parameters = new ArrayList<>();
        if (tab.isPresent()) {
            sql.append(" AND default_for_tab = ?");
            parameters.add(tab.get());
        }
        sql.append(" ORDER BY display_order, viz_name");

        List<VisualizationConfig> visualizations = metadataStore.query(sql.toString(), parameters).stream()
                .map(ConfigRowMapper::toVisualizationConfig)
                .collect(toImmutableList());
        cacheIfNotEmpty(visualizationsByTab, tab, visualizations);
        return visualizations;
    }

    public Optional<VisualizationConfig> getVizConfig(String vizId)
    {
        requireNonNull(vizId, "vizId is null");
        VisualizationConfig cached = visualizationById.getIfPresent(vizId);
        if (cached != null) {
            return Optional.of(cached);
        }

        List<Map<String, Object>> rows = metadataStore.query(
                "SELECT * FROM " + tableName(VISUALIZATION_CONFIGS) + " WHERE id = ? AND is_active = true",
                ImmutableList.of(vizId));
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        VisualizationConfig visualization = ConfigRowMapper.toVisualizationConfig(rows.get(0));
        visualizationById.put(vizId, visualization);
        return Optional.of(visualization);
    }

    /**
     * Returns a value from {@code system_config}, converted according to its
     * {@code config_type}: a {@link Long} for {@code int}, a {@link Boolean} for
     * {@code boolean}, a Jackson {@code JsonNode} for {@code json}, otherwise the text.
     */
    public Optional<Object> getSystemConfig(String key)
    {
        requireNonNull(key, "key is null");
        Object cached = systemConfigByKey.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        List<Map<String, Object>> rows = metadataStore.query(
                "SELECT config_value, config_type FROM " + tableName(SYSTEM_CONFIG) + " WHERE config_key = ?",
                ImmutableList.of(key));
        if (rows.isEmpty() || rows.get(0).get("config_value") == null) {
            return Optional.empty();
        }

        Map<String, Object> row = rows.get(0);
        Object configType = row.get("config_type");
        Object value = ConfigRowMapper.toSystemConfigValue(key, row.get("config_value").toString(), configType == null ? "string" : configType.toString());
        systemConfigByKey.put(key, value);
        return Optional.of(value);
    }

    /**
     * Renders the template of an active query with the supplied parameter values.
     * <p>
     * Each declared parameter takes its value from {@code parameters}, falling back
     * to its default. Every occurrence of its placeholder is replaced literally;
     * parameter values are inserted as-is and never expanded.
     *
     * @throws ConfigurationException if the query is unknown or inactive, a
     * required parameter has no value, or a placeholder remains unresolved
     */
    public String buildQueryFromTemplate(String queryId, Map<String, ?> parameters)
    {
        QueryConfig queryConfig = getQueryConfig(queryId)
                .filter(QueryConfig::active)
                .orElseThrow(() -> new ConfigurationException("Query configuration not found: " + queryId));

        Map<String, String> values = new LinkedHashMap<>();
        for (QueryParameter parameter : queryConfig.parameters()) {
            Object value = parameters.get(parameter.name());
            if (value != null) {
                values.put(parameter.name(), value.toString());
            }
            else if (parameter.required()) {
                throw new ConfigurationException("Required parameter missing: " + parameter.name());
            }
            else {
                parameter.defaultValue().ifPresent(defaultValue -> values.put(parameter.name(), defaultValue));
            }
        }

        Set<String> unresolved = SqlTemplate.unresolved(queryConfig.sqlTemplate(), values);
        if (!unresolved.isEmpty()) {
            throw new ConfigurationException("Unresolved parameters in query " + queryId + ": " + String.join(", ", unresolved));
        }
        return SqlTemplate.render(queryConfig.sqlTemplate(), values);
    }

    /**
     * Renders the drill-down query of a visualization with the values of the
     * clicked data point. The {@code catalog} and {@code schema} parameters are
     * always set to the configured data location.
     *
     * @throws ConfigurationException if the visualization is unknown, does not
     * allow drill down, or has no drill-down query configured
     */
    public String buildDrillDownQuery(String vizId, Map<String, ?> context)
    {
        VisualizationConfig visualization = getVizConfig(vizId)
                .filter(VisualizationConfig::allowDrillDown)
                .orElseThrow(() -> new ConfigurationException("Drill-down not available for visualization: " + vizId));
        String drillDownQueryId = visualization.drillDownQueryId()
                .orElseThrow(() -> new ConfigurationException("No drill-down query configured for visualization: " + vizId));

        Map<String, Object> parameters = new HashMap<>(context);
        parameters.put(CATALOG_PARAMETER, dataCatalog);
        parameters.put(SCHEMA_PARAMETER, dataSchema);
        return buildQueryFromTemplate(drillDownQueryId, parameters);
    }

    /**
     * Reads one row from every configuration table. Returns false, after logging a warning,
     * when any of them cannot be read.
     */
    public boolean validateConfigTablesExist()
    {
        for (String table : REQUIRED_TABLES) {
            try {
                metadataStore.query("SELECT COUNT(*) AS cnt FROM " + tableName(table) + " LIMIT 1", ImmutableList.of());
            }
            catch (CollaboratorException e) {
                log.warn("Configuration table %s is not accessible: %s", tableName(table), e.getMessage());
                return false;
            }
        }
        log.info("All configuration tables exist and are accessible in %s.%s", configCatalog, configSchema);
        return true;
    }

    public void clearCache()
    {
        cache.clear();
        log.info("Configuration cache cleared");
    }

    private static <K, V> void cacheIfNotEmpty(Cache<K, List<V>> lookup, K key, List<V> values)
    {
        if (!values.isEmpty()) {
            lookup.put(key, values);
        }
    }

    private String tableName(String table)
    {
        return configCatalog + "." + configSchema + "." + table;
    }

    private record FilterLookup(Optional<String> filterType, Optional<String> tab)
    {
        FilterLookup
        {
            requireNonNull(filterType, "filterType is null");
            requireNonNull(tab, "tab is null");
        }
    }
}
