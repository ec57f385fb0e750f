/*
 * Copyright 2026 The Closure Compiler Authors.
 *
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

package com.google.javascript.lowering;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.lowering.TreeRewriter.Visitor;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodePredicate;
import com.google.javascript.lowering.ast.SyntaxKind;
import com.google.javascript.lowering.ast.VisitResult;

/**
 * Replaces the ES2016 {@code **} and {@code **=} operators with calls to {@code Math.pow}.
 *
 * <p>A compound assignment to a property evaluates the object (and the key) once, through
 * temporaries hoisted into the enclosing function or file: {@code o.p **= b} becomes {@code (_a =
 * o).p = Math.pow(_a.p, b)}.
 */
public final class ExponentiationLowering implements Transformer {

  @Override
  public String getName() {
    return "ExponentiationLowering";
  }

  @Override
  public Node transformSourceFile(TransformationContext context, Node sourceFile) {
    if (!TransformFlags.has(sourceFile.getTransformFlags(), TransformFlags.CONTAINS_ES2016)) {
      return sourceFile;
    }
    return checkNotNull(context.visitEachChild(sourceFile, new ExponentiationVisitor(context)));
  }

  private static final class ExponentiationVisitor implements Visitor {
    private final TransformationContext context;

    ExponentiationVisitor(TransformationContext context) {
      this.context = context;
    }

    @Override
    public VisitResult visit(Node node) {
      int flags = node.getTransformFlags();
      if (TransformFlags.has(flags, TransformFlags.ES2016)) {
        return visitExponentiation(node);
      } else if (TransformFlags.has(flags, TransformFlags.CONTAINS_ES2016)) {
        return context.visitEachChild(node, this);
      }
      return node;
    }

    private Node visitExponentiation(Node node) {
      checkState(node.isBinaryExpression(), node);
      TreeRewriter rewriter = context.getRewriter();
      Node left = rewriter.visitNode(node.getLeft(), this, NodePredicate.EXPRESSION);
      Node right = rewriter.visitNode(node.getRight(), this, NodePredicate.EXPRESSION);

      Node result;
      if (node.getOperator() == SyntaxKind.ASTERISK_ASTERISK_TOKEN) {
        // a ** b => Math.pow(a, b)
        result = createMathPow(left, right);
      } else {
        checkState(node.getOperator() == SyntaxKind.ASTERISK_ASTERISK_EQUALS_TOKEN, node);
        result = visitExponentiationAssignment(left, right);
      }
      return IR.updateNode(result, node);
    }

    private Node visitExponentiationAssignment(Node left, Node right) {
      if (left.isIdentifier()) {
        // x **= b => x = Math.pow(x, b)
        Node base = IR.identifier(left.getString());
        base.setSourceRange(left);
        return IR.assignment(left, createMathPow(base, right));
      }

      if (!left.isPropertyAccess() && !left.isElementAccess()) {
        // (x) **= b => (x) = Math.pow((x), b)
        Node base = IR.getMutableClone(left);
        return IR.assignment(left, createMathPow(base, right));
      }

      Node object = IR.assignment(context.createTempVariable(), left.getExpression());
      object.setSourceRange(left.getExpression());
      Node objectTemp = object.getLeft();

      Node target;
      Node base;
      if (left.isPropertyAccess()) {
        // o.p **= b => (_a = o).p = Math.pow(_a.p, b)
        String property = left.getName().getString();
        target = IR.propertyAccess(Parenthesizer.parenthesizeForAccess(object), property);
        base = IR.propertyAccess(IR.identifier(objectTemp.getString()), property);
      } else {
        // o[k] **= b => (_a = o)[_b = k] = Math.pow(_a[_b], b)
        Node index = IR.assignment(context.createTempVariable(), left.getArgumentExpression());
        index.setSourceRange(left.getArgumentExpression());
        target = IR.elementAccess(Parenthesizer.parenthesizeForAccess(object), index);
        base =
            IR.elementAccess(
                IR.identifier(objectTemp.getString()), IR.identifier(index.getLeft().getString()));
      }
      target.setSourceRange(left);
      base.setSourceRange(left);
      return IR.assignment(target, createMathPow(base, right));
    }

    private static Node createMathPow(Node base, Node exponent) {
      return IR.call(
          IR.propertyAccess(IR.identifier("Math"), "pow"),
          Parenthesizer.parenthesizeExpressionForList(base),
          Parenthesizer.parenthesizeExpressionForList(exponent));
    }
  }
}
