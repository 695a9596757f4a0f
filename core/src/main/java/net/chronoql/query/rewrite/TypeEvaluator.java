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
package net.chronoql.query.rewrite;

import java.util.List;

import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BooleanLiteral;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DataType;
import net.chronoql.query.ast.Dimension;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.Measurement;
import net.chronoql.query.ast.NumberLiteral;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.Source;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.SubQuery;
import net.chronoql.query.ast.VarRef;

/**
 * Infers the data type an expression produces given the sources it reads.
 *
 * @since 1.0
 */
public final class TypeEvaluator {

  private TypeEvaluator() {
    // static
  }

  /**
   * @param expr The expression to evaluate, may be null.
   * @param sources The non-null sources the expression reads from.
   * @param mapper The non-null mapper for measurement schemas.
   * @return The type, {@link DataType#UNKNOWN} if it can't be determined.
   */
  public static DataType evalType(final Expr expr,
                                  final List<Source> sources,
                                  final FieldMapper mapper) {
    if (expr instanceof VarRef) {
      return refType((VarRef) expr, sources, mapper);
    } else if (expr instanceof Call) {
      return callType((Call) expr, sources, mapper);
    } else if (expr instanceof ParenExpr) {
      return evalType(((ParenExpr) expr).getExpr(), sources, mapper);
    } else if (expr instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) expr;
      if (!binary.getOp().isArithmetic()) {
        return DataType.BOOLEAN;
      }
      final DataType lhs = evalType(binary.getLhs(), sources, mapper);
      final DataType rhs = evalType(binary.getRhs(), sources, mapper);
      return rhs.lessThan(lhs) ? lhs : rhs;
    } else if (expr instanceof NumberLiteral) {
      return DataType.FLOAT;
    } else if (expr instanceof IntegerLiteral) {
      return DataType.INTEGER;
    } else if (expr instanceof StringLiteral) {
      return DataType.STRING;
    } else if (expr instanceof BooleanLiteral) {
      return DataType.BOOLEAN;
    }
    return DataType.UNKNOWN;
  }

  private static DataType refType(final VarRef ref,
                                  final List<Source> sources,
                                  final FieldMapper mapper) {
    if (ref.getType() != DataType.UNKNOWN) {
      return ref.getType();
    }
    DataType type = DataType.UNKNOWN;
    for (final Source source : sources) {
      if (source instanceof Measurement) {
        final DataType mapped = mapper.mapType((Measurement) source,
            ref.getName());
        if (type.lessThan(mapped)) {
          type = mapped;
        }
      } else if (source instanceof SubQuery) {
        final List<Source> inner =
            ((SubQuery) source).getStatement().getSources();
        for (final Field field :
            ((SubQuery) source).getStatement().getFields()) {
          if (field.name().equals(ref.getName())) {
            final DataType mapped = evalType(field.getExpr(), inner, mapper);
            if (type.lessThan(mapped)) {
              type = mapped;
            }
            break;
          }
        }
        if (type == DataType.UNKNOWN) {
          // grouped by in the subquery so it's a tag to the parent
          for (final Dimension dimension :
              ((SubQuery) source).getStatement().getDimensions()) {
            if (dimension.getExpr() instanceof VarRef &&
                ((VarRef) dimension.getExpr()).getName().equals(
                    ref.getName())) {
              type = DataType.TAG;
            }
          }
        }
      }
    }
    return type;
  }

  private static DataType callType(final Call call,
                                   final List<Source> sources,
                                   final FieldMapper mapper) {
    switch (call.getName()) {
    case "mean":
    case "median":
    case "integral":
    case "stddev":
    case "derivative":
    case "non_negative_derivative":
    case "moving_average":
    case "holt_winters":
    case "holt_winters_with_fit":
      return DataType.FLOAT;
    case "count":
    case "elapsed":
      return DataType.INTEGER;
    default:
      if (call.getArgs().isEmpty()) {
        return DataType.UNKNOWN;
      }
      return evalType(call.getArgs().get(0), sources, mapper);
    }
  }
}
