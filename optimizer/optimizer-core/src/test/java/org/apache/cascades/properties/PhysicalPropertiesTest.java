// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.cascades.properties;

import org.apache.cascades.trees.expressions.ExprId;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.types.DataType;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PhysicalPropertiesTest {
    private final SlotReference a = new SlotReference(new ExprId(0), "a", DataType.INT, "t");
    private final SlotReference b = new SlotReference(new ExprId(1), "b", DataType.INT, "t");

    @Test
    public void testAny() {
        Assertions.assertSame(PhysicalProperties.ANY, PhysicalProperties.of(OrderSpec.EMPTY));
        Assertions.assertSame(PhysicalProperties.ANY, PhysicalProperties.ordered(ImmutableList.of()));
        Assertions.assertTrue(PhysicalProperties.ANY.isAny());
        Assertions.assertFalse(PhysicalProperties.ANY.withExpectedRowCount(10).isAny());
        Assertions.assertSame(PhysicalProperties.ANY,
                PhysicalProperties.ANY.withExpectedRowCount(10).withoutExpectedRowCount());
    }

    @Test
    public void testOrderPrefixSatisfies() {
        PhysicalProperties ab = PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(a), OrderKey.asc(b)));
        PhysicalProperties aOnly = PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(a)));

        Assertions.assertTrue(ab.satisfy(aOnly));
        Assertions.assertTrue(ab.satisfy(ab));
        Assertions.assertTrue(ab.satisfy(PhysicalProperties.ANY));
        Assertions.assertFalse(aOnly.satisfy(ab));
        Assertions.assertFalse(ab.satisfy(PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(b)))));
        Assertions.assertFalse(ab.satisfy(PhysicalProperties.ordered(ImmutableList.of(OrderKey.desc(a)))));
        Assertions.assertFalse(PhysicalProperties.ANY.satisfy(aOnly));
    }

    @Test
    public void testExpectedRowCountNeverRejects() {
        PhysicalProperties aOnly = PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(a)));

        Assertions.assertTrue(aOnly.satisfy(aOnly.withExpectedRowCount(10)));
        Assertions.assertTrue(PhysicalProperties.ANY.satisfy(PhysicalProperties.ANY.withExpectedRowCount(0)));
        Assertions.assertTrue(aOnly.withExpectedRowCount(10).satisfy(aOnly));
        Assertions.assertNotEquals(aOnly, aOnly.withExpectedRowCount(10));
        Assertions.assertEquals(aOnly, aOnly.withExpectedRowCount(10).withoutExpectedRowCount());
        Assertions.assertEquals(PhysicalProperties.ANY.withExpectedRowCount(10), aOnly.withExpectedRowCount(10)
                .withoutOrder());
    }

    @Test
    public void testInvalidExpectedRowCount() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PhysicalProperties.ANY.withExpectedRowCount(-1));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PhysicalProperties.ANY.withExpectedRowCount(Double.NaN));
    }
}
