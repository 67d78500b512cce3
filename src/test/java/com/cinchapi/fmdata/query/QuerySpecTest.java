/*
 * Copyright (c) 2013-2025 Cinchapi Inc.
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
package com.cinchapi.fmdata.query;

import org.junit.Assert;
import org.junit.Test;

import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.paginate.Window;
import com.cinchapi.fmdata.query.SortKey.Direction;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;

/**
 * Unit tests for {@link QuerySpec}.
 *
 * @author Jeff Nelson
 */
public class QuerySpecTest {

    @Test
    public void testDefaults() {
        QuerySpec spec = QuerySpec.create();
        Assert.assertTrue(spec.clauses().isEmpty());
        Assert.assertTrue(spec.sort().isEmpty());
        Assert.assertEquals(Window.ALL, spec.window());
        Assert.assertFalse(spec.isSliced());
        Assert.assertEquals(QuerySpec.DEFAULT_CHUNK_SIZE, spec.chunkSize());
        Assert.assertTrue(spec.scripts().isEmpty());
        Assert.assertNull(spec.responseLayout());
    }

    @Test
    public void testCopiesAreIndependent() {
        QuerySpec base = QuerySpec.create();
        QuerySpec found = base.withClause(
                SearchClause.find(ImmutableMap.of("Name", "==Ann")));
        Assert.assertTrue(base.clauses().isEmpty());
        Assert.assertEquals(1, found.clauses().size());
    }

    @Test
    public void testSortKeysAppend() {
        QuerySpec base = QuerySpec.create().withSortKeys(
                ImmutableList.of(SortKey.of("Name", Direction.ASCEND)));
        QuerySpec spec = base.withSortKeys(
                ImmutableList.of(SortKey.of("Age", Direction.DESCEND)));
        Assert.assertEquals(ImmutableList.of(
                SortKey.of("Name", Direction.ASCEND),
                SortKey.of("Age", Direction.DESCEND)), spec.sort());
        Assert.assertEquals(1, base.sort().size());
    }

    @Test
    public void testPortalRequestForSameNameReplaces() {
        QuerySpec spec = QuerySpec.create()
                .withPortal(PortalRequest.of("notes"))
                .withPortal(PortalRequest.of("notes", 5, 10));
        Assert.assertEquals(1, spec.portals().size());
        Assert.assertEquals(5, spec.portals().get("notes").offset());
    }

    @Test
    public void testSlicesCompose() {
        QuerySpec spec = QuerySpec.create().withSlice(0, 10).withSlice(2, 5);
        Assert.assertEquals(Window.of(2, 5), spec.window());
        Assert.assertTrue(spec.isSliced());
    }

    @Test
    public void testCannotShapeAfterSlice() {
        QuerySpec sliced = QuerySpec.create().withSlice(0, 10);
        try {
            sliced.withSortKeys(ImmutableList.of());
            Assert.fail();
        }
        catch (ValidationException e) {
            Assert.assertTrue(e.getMessage().contains("sort"));
        }
        try {
            sliced.withChunkSize(5);
            Assert.fail();
        }
        catch (ValidationException e) {
            Assert.assertTrue(e.getMessage().contains("sliced"));
        }
    }

    @Test(expected = ValidationException.class)
    public void testNegativeSliceIsRejected() {
        QuerySpec.create().withSlice(-1, 3);
    }

    @Test(expected = ValidationException.class)
    public void testChunkSizeMustBePositive() {
        QuerySpec.create().withChunkSize(0);
    }

    @Test
    public void testClauseJsonCarriesOmitFlag() {
        JsonObject json = SearchClause
                .find(ImmutableMap.of("Name", "==Ann")).toJson();
        Assert.assertEquals("==Ann", json.get("Name").getAsString());
        Assert.assertEquals("false", json.get("omit").getAsString());
        Assert.assertEquals("true", SearchClause
                .omit(ImmutableMap.of("City", "==Rome")).toJson().get("omit")
                .getAsString());
    }

    @Test
    public void testScriptParametersAreOrdered() {
        Scripts scripts = Scripts.none()
                .withAfter(ScriptRequest.of("After", "x"))
                .withPreRequest(ScriptRequest.of("Before", null))
                .withPreSort(ScriptRequest.of("Sort", "y"));
        Assert.assertEquals(ImmutableList.of("script.prerequest",
                "script.presort", "script.presort.param", "script",
                "script.param"),
                ImmutableList.copyOf(scripts.toParameters().keySet()));
        Assert.assertEquals("x", scripts.toParameters().get("script.param"));
    }

    @Test
    public void testPortalRequestFirstPageLimit() {
        Assert.assertEquals(100, PortalRequest.of("notes").firstPageLimit());
        Assert.assertEquals(3, PortalRequest.of("notes", 0, 3)
                .firstPageLimit());
        Assert.assertEquals(2, PortalRequest.of("notes", 0, 10)
                .withChunkSize(2).firstPageLimit());
    }

    @Test(expected = ValidationException.class)
    public void testPortalRequestRejectsNegativeOffset() {
        PortalRequest.of("notes", -1, null);
    }

}
