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

package com.google.lambdalowering.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of a typed method tree. All node kinds share this class; the {@link Token} tells them
 * apart and the symbol slots hold the kind-specific data:
 *
 * <ul>
 *   <li>{@code VAR}, {@code NAME}: the {@link Variable}
 *   <li>{@code METHOD}, {@code LAMBDA}, {@code LOCAL_FUNCTION}, {@code FUNCTION_NAME}: the {@link
 *       FunctionSymbol}
 *   <li>{@code GETFIELD}: the {@link SynthesizedField}
 *   <li>{@code GETMETHOD}, {@code METHOD_REF}: the {@link SynthesizedMethod}
 *   <li>{@code NEW_ENV}, {@code DEFAULT_ENV}: the instantiated environment {@link TypeRef}
 *   <li>{@code GETPROP}, {@code STRINGLIT}: a string; {@code NUMBER}: a double
 * </ul>
 *
 * <p>Children are kept in a linked list: {@code first.previous} points at the last child, and
 * {@code last.next} is null.
 */
public final class Node {

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable String string;
  private double number;
  private @Nullable Variable variable;
  private @Nullable FunctionSymbol function;
  private @Nullable SynthesizedField field;
  private @Nullable SynthesizedMethod method;
  private @Nullable TypeRef typeRef;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public static Node newString(Token token, String str) {
    checkArgument(token == Token.STRINGLIT || token == Token.GETPROP, token);
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  // Tree structure

  public @Nullable Node getParent() {
    return parent;
  }

  public boolean hasChildren() {
    return first != null;
  }

  public boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public @Nullable Node getLastChild() {
    return first == null ? null : first.previous;
  }

  public @Nullable Node getNext() {
    return next;
  }

  /** Returns the previous sibling, or null for the first child. */
  public @Nullable Node getPrevious() {
    return this.parent == null || this.parent.first == this ? null : previous;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "%s does not have exactly one child", this);
    return first;
  }

  public int getChildCount() {
    int count = 0;
    for (Node c = first; c != null; c = c.next) {
      count++;
    }
    return count;
  }

  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = checkNotNull(n, "index out of bounds").next;
      i--;
    }
    return checkNotNull(n, "index out of bounds");
  }

  /** Iterates over the children; the current child may be detached during iteration. */
  public Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node cursor = first;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            if (cursor == null) {
              throw new NoSuchElementException();
            }
            Node result = cursor;
            cursor = cursor.next;
            return result;
          }
        };
  }

  public void addChildToFront(Node child) {
    checkDetached(child);
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public void addChildToBack(Node child) {
    checkDetached(child);
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Inserts this detached node as the sibling following {@code existing}. */
  public void insertAfter(Node existing) {
    Node parentNode = checkNotNull(existing.parent, "%s has no parent", existing);
    checkDetached(this);
    this.parent = parentNode;
    this.previous = existing;
    this.next = existing.next;
    if (existing.next == null) {
      parentNode.first.previous = this;
    } else {
      existing.next.previous = this;
    }
    existing.next = this;
  }

  /** Inserts this detached node as the sibling preceding {@code existing}. */
  public void insertBefore(Node existing) {
    Node parentNode = checkNotNull(existing.parent, "%s has no parent", existing);
    if (parentNode.first == existing) {
      parentNode.addChildToFront(this);
    } else {
      insertAfter(existing.previous);
    }
  }

  /** Puts {@code replacement} in the place of this node, detaching this node. */
  public void replaceWith(Node replacement) {
    checkNotNull(parent, "%s has no parent", this);
    replacement.insertAfter(this);
    detach();
  }

  public Node detach() {
    Node parentNode = checkNotNull(parent, "%s has no parent", this);
    if (parentNode.first == this) {
      parentNode.first = next;
      if (next != null) {
        next.previous = previous;
      }
    } else {
      previous.next = next;
      if (next == null) {
        parentNode.first.previous = previous;
      } else {
        next.previous = previous;
      }
    }
    parent = null;
    next = null;
    previous = null;
    return this;
  }

  private static void checkDetached(Node child) {
    checkArgument(
        child.parent == null && child.next == null && child.previous == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s",
        child,
        child.parent);
  }

  /** Copies this node and all descendants. Symbols are shared, not copied. */
  public Node cloneTree() {
    Node copy = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      copy.addChildToBack(c.cloneTree());
    }
    return copy;
  }

  public Node cloneNode() {
    Node copy = new Node(token);
    copy.string = string;
    copy.number = number;
    copy.variable = variable;
    copy.function = function;
    copy.field = field;
    copy.method = method;
    copy.typeRef = typeRef;
    return copy;
  }

  // Kind-specific data

  public String getString() {
    return checkNotNull(string, "%s has no string", this);
  }

  public double getDouble() {
    checkState(token == Token.NUMBER, this);
    return number;
  }

  public Variable getVariable() {
    return checkNotNull(variable, "%s has no variable", this);
  }

  public Node setVariable(Variable variable) {
    checkState(token == Token.VAR || token == Token.NAME, this);
    this.variable = checkNotNull(variable);
    return this;
  }

  public FunctionSymbol getFunction() {
    return checkNotNull(function, "%s has no function symbol", this);
  }

  public Node setFunction(FunctionSymbol function) {
    checkState(token.isFunction() || token == Token.FUNCTION_NAME, this);
    this.function = checkNotNull(function);
    return this;
  }

  public SynthesizedField getField() {
    return checkNotNull(field, "%s has no field", this);
  }

  public Node setField(SynthesizedField field) {
    checkState(token == Token.GETFIELD, this);
    this.field = checkNotNull(field);
    return this;
  }

  public SynthesizedMethod getMethod() {
    return checkNotNull(method, "%s has no method", this);
  }

  public Node setMethod(SynthesizedMethod method) {
    checkState(token == Token.GETMETHOD || token == Token.METHOD_REF, this);
    this.method = checkNotNull(method);
    return this;
  }

  public TypeRef getTypeRef() {
    return checkNotNull(typeRef, "%s has no type", this);
  }

  public Node setTypeRef(TypeRef typeRef) {
    checkState(token == Token.NEW_ENV || token == Token.DEFAULT_ENV, this);
    this.typeRef = checkNotNull(typeRef);
    return this;
  }

  // Predicates

  public boolean isMethod() {
    return token == Token.METHOD;
  }

  public boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public boolean isLocalFunction() {
    return token == Token.LOCAL_FUNCTION;
  }

  public boolean isFunction() {
    return token.isFunction();
  }

  public boolean isNestedFunction() {
    return token == Token.LAMBDA || token == Token.LOCAL_FUNCTION;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isVar() {
    return token == Token.VAR;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isThis() {
    return token == Token.THIS;
  }

  public boolean isFunctionName() {
    return token == Token.FUNCTION_NAME;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  /** Whether this node is the callee of its parent CALL. */
  public boolean isCallee() {
    return parent != null && parent.isCall() && parent.first == this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.toString());
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (variable != null) {
      sb.append(' ').append(variable.getName());
    }
    if (function != null) {
      sb.append(' ').append(function.getName());
    }
    if (field != null) {
      sb.append(' ').append(field.getName());
    }
    if (method != null) {
      sb.append(' ').append(method.getName());
    }
    if (typeRef != null) {
      sb.append(' ').append(typeRef);
    }
    return sb.toString();
  }

  /** Prints the subtree, one node per line, indented by depth. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int depth) {
    sb.append("    ".repeat(depth)).append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, depth + 1);
    }
  }
}
