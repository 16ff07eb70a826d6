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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestSqlTemplate
{
    @Test
    public void testPlaceholders()
    {
        assertThat(SqlTemplate.placeholders("SELECT * FROM ${catalog}.${schema}.t WHERE a = '${a}' OR b = '${a}'"))
                .containsExactly("catalog", "schema", "a");
        assertThat(SqlTemplate.placeholders("SELECT '$' || '{x' FROM t")).isEmpty();
    }

    @Test
    public void testRenderIsLiteral()
    {
        assertThat(SqlTemplate.render("WHERE name = '${name}' AND alias = '${name}'", ImmutableMap.of("name", "O'Brien")))
                .isEqualTo("WHERE name = 'O'Brien' AND alias = 'O'Brien'");
        assertThat(SqlTemplate.render("WHERE a = ${a} AND b = ${b}", ImmutableMap.of("a", "1")))
                .isEqualTo("WHERE a = 1 AND b = ${b}");
    }

    @Test
    public void testInsertedValuesAreNotExpanded()
    {
        assertThat(SqlTemplate.render("WHERE a = '${a}' AND b = '${b}'", ImmutableMap.of("a", "${b}", "b", "x")))
                .isEqualTo("WHERE a = '${b}' AND b = 'x'");
        assertThat(SqlTemplate.render("WHERE price = '${price}'", ImmutableMap.of("price", "$5 \\ each")))
                .isEqualTo("WHERE price = '$5 \\ each'");
    }

    @Test
    public void testUnresolved()
    {
        assertThat(SqlTemplate.unresolved("WHERE a = ${a} AND b = ${b} AND c = ${c}", ImmutableMap.of("b", "${c}")))
                .containsExactly("a", "c");
        assertThat(SqlTemplate.unresolved("WHERE a = ${a}", ImmutableMap.of("a", "cost ${usd}"))).isEmpty();
    }
}
