// This file is part of ChronoQL.
// Copyright (C) 2024  The ChronoQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.chronoql.query.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestExprs {

  @Test
  public void contains() throws Exception {
    final Expr expr = new BinaryExpr(BinaryOp.AND,
        new ParenExpr(new BinaryExpr(BinaryOp.GT, new VarRef("time"),
            new Call("now"))),
        new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
            new StringLiteral("a")));
    assertTrue(Exprs.contains(expr, Call.class));
    assertTrue(Exprs.contains(expr, StringLiteral.class));
    assertFalse(Exprs.contains(expr, RegexLiteral.class));
    assertFalse(Exprs.contains(null, VarRef.class));
    assertTrue(Exprs.contains(new Call("max", new Wildcard()),
        Wildcard.class));
  }

  @Test
  public void unwrap() throws Exception {
    final VarRef ref = new VarRef("value");
    assertSame(ref, Exprs.unwrap(new ParenExpr(new ParenExpr(ref))));
    assertSame(ref, Exprs.unwrap(ref));
  }

  @Test
  public void string() throws Exception {
    assertEquals("\"my-field\"", new VarRef("my-field").toString());
    assertEquals("percentile(value, 90)", new Call("percentile",
        new VarRef("value"), new IntegerLiteral(90)).toString());
    assertEquals("value =~ /^a\\/b/", new BinaryExpr(BinaryOp.EQREGEX,
        new VarRef("value"), new RegexLiteral("^a/b")).toString());
    assertEquals("'it\\'s'", new StringLiteral("it's").toString());
    assertEquals("-10m", new DurationLiteral(-600000000000L).toString());
    assertEquals("DISTINCT host", new Distinct("host").toString());
    assertEquals("*::field", new Wildcard(Wildcard.WildcardType.FIELD)
        .toString());
  }

  @Test
  public void binaryOps() throws Exception {
    assertTrue(BinaryOp.MOD.isArithmetic());
    assertFalse(BinaryOp.AND.isArithmetic());
    assertTrue(BinaryOp.LTE.isComparison());
    assertFalse(BinaryOp.EQREGEX.isComparison());
    assertEquals(BinaryOp.GTE, BinaryOp.LTE.mirror());
    assertEquals(BinaryOp.EQ, BinaryOp.EQ.mirror());
  }

  @Test
  public void dataTypes() throws Exception {
    assertTrue(DataType.INTEGER.lessThan(DataType.FLOAT));
    assertFalse(DataType.FLOAT.lessThan(DataType.INTEGER));
    assertTrue(DataType.UNKNOWN.lessThan(DataType.BOOLEAN));
    assertFalse(DataType.STRING.lessThan(DataType.UNKNOWN));
    assertTrue(DataType.UNSIGNED.isNumeric());
    assertFalse(DataType.TAG.isNumeric());
    assertEquals("integer", DataType.INTEGER.castName());
  }
}
