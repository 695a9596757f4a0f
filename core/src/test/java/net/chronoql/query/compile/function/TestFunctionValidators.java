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
package net.chronoql.query.compile.function;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.VarRef;

public class TestFunctionValidators {

  @Test
  public void registry() throws Exception {
    assertEquals(ImmutableSet.of("max", "min", "first", "last", "count",
        "sum", "mean", "median", "mode", "stddev", "spread", "percentile",
        "sample", "distinct", "top", "bottom", "derivative",
        "non_negative_derivative", "elapsed", "difference",
        "non_negative_difference", "cumulative_sum", "moving_average",
        "integral", "holt_winters", "holt_winters_with_fit"),
        FunctionValidators.names());
    for (final String name : FunctionValidators.names()) {
      assertNotNull(name, FunctionValidators.get(name));
    }
    assertNull(FunctionValidators.get("foo"));
    assertNull(FunctionValidators.get("MEAN"));
    assertNull(FunctionValidators.get("now"));
    assertSame(FunctionValidators.get("top"),
        FunctionValidators.get("bottom"));
    assertTrue(FunctionValidators.get("max") instanceof AggregateValidator);
  }

  @Test
  public void checkArity() throws Exception {
    FunctionValidators.checkArity(new Call("mean", new VarRef("a")), 1);
    try {
      FunctionValidators.checkArity(new Call("mean"), 1);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(Reason.INVALID_ARGUMENT, e.getReason());
      assertEquals("invalid number of arguments for mean, expected 1, got 0",
          e.getMessage());
    }
  }

  @Test
  public void checkArityRange() throws Exception {
    FunctionValidators.checkArity(new Call("derivative", new VarRef("a"),
        new DurationLiteral(1)), 1, 2);
    try {
      FunctionValidators.checkArity(new Call("derivative", new VarRef("a"),
          new DurationLiteral(1), new IntegerLiteral(1)), 1, 2);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals("invalid number of arguments for derivative, expected at "
          + "least 1 but no more than 2, got 3", e.getMessage());
    }
  }

  @Test
  public void typeName() throws Exception {
    assertEquals("IntegerLiteral",
        FunctionValidators.typeName(new IntegerLiteral(1)));
    assertEquals("VarRef", FunctionValidators.typeName(new VarRef("a")));
  }
}
