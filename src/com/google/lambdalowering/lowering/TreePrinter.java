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

package com.google.lambdalowering.lowering;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedField;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;
import com.google.lambdalowering.ir.Token;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints trees and synthesized declarations as compact, single-line source text. Used for debug
 * logging and for comparing trees in tests.
 */
public final class TreePrinter {

  private final StringBuilder sb = new StringBuilder();

  private TreePrinter() {}

  public static String print(Node n) {
    TreePrinter printer = new TreePrinter();
    printer.add(n);
    return printer.sb.toString();
  }

  /** Prints a synthesized type with its fields, e.g. {@code class Env$m$0 { int x; }}. */
  public static String printType(SynthesizedType type) {
    StringBuilder out = new StringBuilder();
    out.append(type.isValueType() ? "struct " : "class ").append(type.getName());
    appendTypeParameters(out, type.getTypeParameters());
    out.append(" {");
    for (SynthesizedField field : type.getFields()) {
      out.append(' ').append(field.getType()).append(' ').append(field.getName()).append(';');
    }
    return out.append(type.getFields().isEmpty() ? "}" : " }").toString();
  }

  /** Prints the signature and body of a lowered method. */
  public static String printMethod(SynthesizedMethod method) {
    StringBuilder out = new StringBuilder();
    if (method.isStatic()) {
      out.append("static ");
    }
    out.append(method.getReturnType()).append(' ');
    out.append(method.getOwnerName()).append('.').append(method.getName());
    appendTypeParameters(out, method.getTypeParameters());
    List<String> params = new ArrayList<>();
    for (Variable param : method.getParameters()) {
      params.add((param.isByReference() ? "ref " : "") + param.getType() + " " + param.getName());
    }
    out.append('(').append(Joiner.on(", ").join(params)).append(')');
    if (method.getBody() != null) {
      out.append(' ').append(print(method.getBody()));
    }
    return out.toString();
  }

  private static void appendTypeParameters(StringBuilder out, List<String> typeParameters) {
    if (!typeParameters.isEmpty()) {
      out.append('<').append(Joiner.on(", ").join(typeParameters)).append('>');
    }
  }

  private void add(String s) {
    sb.append(s);
  }

  private void add(Node n) {
    Token token = n.getToken();
    if (token.isBinaryOperator()) {
      checkState(n.getChildCount() == 2, "Bad binary operator %s", n);
      addOperand(n.getFirstChild(), n);
      add(" " + Token.opToStr(token) + " ");
      addOperand(n.getLastChild(), n);
      return;
    }

    switch (token) {
      case METHOD:
        add(n.getFunction().getName());
        addParams(n.getFirstChild());
        add(" ");
        add(n.getLastChild());
        break;
      case LAMBDA:
        addParams(n.getFirstChild());
        add(" -> ");
        add(n.getLastChild());
        break;
      case LOCAL_FUNCTION:
        add("function " + n.getFunction().getName());
        addParams(n.getFirstChild());
        add(" ");
        add(n.getLastChild());
        break;
      case BLOCK:
        if (!n.hasChildren()) {
          add("{}");
          break;
        }
        add("{");
        for (Node c : n.children()) {
          add(" ");
          add(c);
        }
        add(" }");
        break;
      case VAR:
        add("var " + n.getVariable().getName());
        if (n.hasChildren()) {
          add(" = ");
          add(n.getFirstChild());
        }
        add(";");
        break;
      case EXPR_RESULT:
        add(n.getFirstChild());
        add(";");
        break;
      case RETURN:
        add("return");
        if (n.hasChildren()) {
          add(" ");
          add(n.getFirstChild());
        }
        add(";");
        break;
      case IF:
        add("if (");
        add(n.getFirstChild());
        add(") ");
        add(n.getSecondChild());
        if (n.getChildCount() == 3) {
          add(" else ");
          add(n.getLastChild());
        }
        break;
      case WHILE:
        add("while (");
        add(n.getFirstChild());
        add(") ");
        add(n.getLastChild());
        break;
      case NAME:
        add(n.getVariable().getName());
        break;
      case THIS:
        add("this");
        break;
      case FUNCTION_NAME:
        add(n.getFunction().getName());
        break;
      case CALL:
        add(n.getFirstChild());
        add("(");
        boolean firstArg = true;
        for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
          if (!firstArg) {
            add(", ");
          }
          add(arg);
          firstArg = false;
        }
        add(")");
        break;
      case GETPROP:
        add(n.getFirstChild());
        add("." + n.getString());
        break;
      case GETFIELD:
        add(n.getFirstChild());
        add("." + n.getField().getName());
        break;
      case GETMETHOD:
        addMethodAccess(n, ".");
        break;
      case METHOD_REF:
        addMethodAccess(n, "::");
        break;
      case NEW_ENV:
        add("new " + n.getTypeRef() + "()");
        break;
      case DEFAULT_ENV:
        add("default(" + n.getTypeRef() + ")");
        break;
      case REF:
        add("ref ");
        add(n.getFirstChild());
        break;
      case NOT:
        add("!");
        addOperand(n.getFirstChild(), n);
        break;
      case NUMBER:
        double d = n.getDouble();
        add(d == (long) d ? Long.toString((long) d) : Double.toString(d));
        break;
      case STRINGLIT:
        add("\"" + n.getString() + "\"");
        break;
      case TRUE:
        add("true");
        break;
      case FALSE:
        add("false");
        break;
      case NULL:
        add("null");
        break;
      default:
        throw new IllegalStateException("Unexpected node: " + n);
    }
  }

  private void addOperand(Node operand, Node operator) {
    boolean parens =
        operand.getToken().isBinaryOperator()
            && !(operator.isAssign() && operand == operator.getLastChild());
    if (parens) {
      add("(");
    }
    add(operand);
    if (parens) {
      add(")");
    }
  }

  private void addParams(Node paramList) {
    add("(");
    boolean first = true;
    for (Node param : paramList.children()) {
      if (!first) {
        add(", ");
      }
      add(param.getVariable().getName());
      first = false;
    }
    add(")");
  }

  private void addMethodAccess(Node n, String separator) {
    SynthesizedMethod method = n.getMethod();
    if (n.hasChildren()) {
      add(n.getFirstChild());
    } else {
      add(method.getOwnerName());
    }
    add(separator + method.getName());
  }
}
