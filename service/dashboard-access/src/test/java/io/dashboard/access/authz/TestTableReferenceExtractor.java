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
package io.dashboard.access.authz;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class TestTableReferenceExtractor
{
    @Test
    public void testFromAndJoin()
    {
        List<TableReference> references = TableReferenceExtractor.extract(
                "SELECT * FROM cat.sch.orders o join sch.customers c ON o.cid = c.id JOIN cat.sch.orders x ON true");

        assertThat(references).containsExactly(
                new TableReference("cat.sch.orders", Optional.of("cat"), "sch", "orders"),
                new TableReference("sch.customers", Optional.empty(), "sch", "customers"));
    }

    @Test
    public void testSingleSegmentNamesAreIgnored()
    {
        assertThat(TableReferenceExtractor.extract("SELECT * FROM orders WHERE x = 1")).isEmpty();
    }

    @Test
    public void testKeywordMustBeAWord()
    {
        assertThat(TableReferenceExtractor.extract("SELECT datefrom.value FROM a.b")).extracting(TableReference::reference)
                .containsExactly("a.b");
    }

    @Test
    public void testQualifiedName()
    {
        TableReference twoPart = TableReferenceExtractor.extract("select 1 from sch.t").get(0);

        assertThat(twoPart.qualifiedName("hive_metastore")).isEqualTo("hive_metastore.sch.t");
        assertThat(twoPart.catalogOr("hive_metastore")).isEqualTo("hive_metastore");
    }
}
