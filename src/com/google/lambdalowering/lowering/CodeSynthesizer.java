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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.lambdalowering.ir.FunctionSymbol;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Declares the environment types and the lowered method of every nested function. All signatures
 * are final before the rewriter touches a call site, since local functions may call each other
 * forwards or recursively.
 */
final class CodeSynthesizer {
  private static final Logger logger = Logger.getLogger(CodeSynthesizer.class.getName());

  static final String RECEIVER_FIELD = "$this";
  static final String PARENT_FIELD = "$parent";
  static final String ENVIRONMENT_LOCAL_PREFIX = "$env";
  static final String TYPE_PARAMETER_PREFIX = "$";

  /** Innermost environment first; ties broken by creation order. */
  static final Comparator<ClosureEnvironment> REF_PARAMETER_ORDER =
      Comparator.comparingInt((ClosureEnvironment env) -> -env.getScope().getDepth())
          .thenComparingInt(ClosureEnvironment::getIndex);

  private final ScopeTree tree;
  private final CompilerOptions options;
  private final UniqueNameSupplier names;
  private final String methodName;

  private CodeSynthesizer(ScopeTree tree, CompilerOptions options, UniqueNameSupplier names) {
    this.tree = tree;
    this.options = options;
    this.names = names;
    this.methodName = tree.getMethodSymbol().getName();
  }

  static void synthesize(ScopeTree tree, CompilerOptions options, UniqueNameSupplier names) {
    CodeSynthesizer synthesizer = new CodeSynthesizer(tree, options, names);
    synthesizer.checkEnvironments();
    synthesizer.declareEnvironmentTypes();
    synthesizer.declareLoweredMethods();
  }

  /**
   * The type of {@code env} as seen from code whose enclosing type parameters are renamed by
   * {@code substitution}.
   */
  static TypeRef environmentTypeIn(ClosureEnvironment env, Map<String, TypeRef> substitution) {
    SynthesizedType type = checkNotNull(env.getSynthesizedType(), "%s not declared", env);
    ImmutableList.Builder<TypeRef> args = ImmutableList.builder();
    for (String typeParameter : env.getSourceTypeParameters()) {
      args.add(TypeRef.typeParameter(typeParameter).substitute(substitution));
    }
    return type.asTypeRef(args.build());
  }

  /**
   * Whether the lowered method of {@code closure} is static: it is neither lowered onto an
   * environment nor reads the enclosing receiver directly.
   */
  static boolean isStatic(ScopeTree tree, Closure closure) {
    if (closure.getContainingEnvironment() != null) {
      return false;
    }
    Variable receiver = tree.getReceiver();
    return receiver == null
        || !closure.captures(receiver)
        || tree.getHoistingEnvironment(receiver) != null;
  }

  private void checkEnvironments() {
    Map<Variable, ClosureEnvironment> owners = new IdentityHashMap<>();
    for (ClosureEnvironment env : tree.getEnvironments()) {
      for (Variable variable : env.getHoistedVariables()) {
        ClosureEnvironment previous = owners.put(variable, env);
        if (previous != null) {
          throw new ClosureConversionException(
              ClosureConversionErrors.ILLEGAL_REFERENCE_CAPTURE,
              variable + " is hoisted into both " + previous + " and " + env);
        }
      }
      if (env.capturesParent()) {
        ClosureEnvironment parent = env.getParent();
        if (env.isValueType() || (parent != null && parent.isValueType())) {
          throw new ClosureConversionException(
              ClosureConversionErrors.ILLEGAL_REFERENCE_CAPTURE,
              env + " links to " + (parent == null ? "the receiver" : parent));
        }
      }
    }

    for (Closure closure : tree.getClosures()) {
      for (ClosureEnvironment env : closure.getCapturedEnvironments()) {
        if (env.isValueType()) {
          if (!closure.canTakeRefParameters()) {
            throw new ClosureConversionException(
                ClosureConversionErrors.ILLEGAL_REFERENCE_CAPTURE,
                closure + " escapes but captures " + env);
          }
        } else if (!isOnChain(env, closure.getContainingEnvironment())) {
          throw new ClosureConversionException(
              ClosureConversionErrors.UNREACHABLE_ENVIRONMENT, env, closure);
        }
      }
    }
  }

  private static boolean isOnChain(ClosureEnvironment target, ClosureEnvironment start) {
    for (ClosureEnvironment env = start; env != null; ) {
      if (env == target) {
        return true;
      }
      env = env.capturesParent() ? env.getParent() : null;
    }
    return false;
  }

  private void declareEnvironmentTypes() {
    for (ClosureEnvironment env : tree.getEnvironments()) {
      List<String> sourceTypeParameters = typeParametersInScope(env.getScope());
      ImmutableList.Builder<String> renamed = ImmutableList.builder();
      for (String typeParameter : sourceTypeParameters) {
        renamed.add(TYPE_PARAMETER_PREFIX + typeParameter);
      }
      SynthesizedType type =
          new SynthesizedType(
              names.getUniqueName(options.getEnvironmentTypePrefix() + methodName + "$"),
              env.isValueType() ? SynthesizedType.Kind.VALUE : SynthesizedType.Kind.REFERENCE,
              renamed.build());
      env.setSynthesizedType(type, sourceTypeParameters);
    }

    for (ClosureEnvironment env : tree.getEnvironments()) {
      SynthesizedType type = env.getSynthesizedType();
      Map<String, TypeRef> substitution = renamingOf(env);
      for (Variable variable : env.getHoistedVariables()) {
        String fieldName = variable.isReceiver() ? RECEIVER_FIELD : variable.getName();
        type.addHoistedField(fieldName, variable.getType().substitute(substitution), variable);
      }
      if (env.capturesParent()) {
        ClosureEnvironment parent = env.getParent();
        TypeRef parentType =
            parent == null
                ? tree.getMethodSymbol().getOwnerType()
                : environmentTypeIn(parent, substitution);
        type.addParentField(PARENT_FIELD, parentType);
      }
      logger.fine(() -> "Declared " + TreePrinter.printType(type));
    }
  }

  private void declareLoweredMethods() {
    FunctionSymbol method = tree.getMethodSymbol();
    for (Closure closure : tree.getClosures()) {
      ClosureEnvironment containing = closure.getContainingEnvironment();
      FunctionSymbol symbol = closure.getSymbol();

      // Type parameters of enclosing functions are either renamed by the containing environment
      // or redeclared on the lowered method.
      List<String> inherited = typeParametersInScope(closure.getDeclaringScope());
      Map<String, TypeRef> substitution = new LinkedHashMap<>();
      int renamedCount = 0;
      if (containing != null) {
        substitution.putAll(renamingOf(containing));
        renamedCount = containing.getSourceTypeParameters().size();
      }
      ImmutableList.Builder<String> typeParameters = ImmutableList.builder();
      typeParameters.addAll(inherited.subList(renamedCount, inherited.size()));
      typeParameters.addAll(symbol.getTypeParameters());
      closure.setTypeSubstitution(substitution);

      ImmutableList.Builder<Variable> parameters = ImmutableList.builder();
      for (Variable original : closure.getParameters()) {
        Variable lowered = original;
        TypeRef type = original.getType().substitute(substitution);
        if (!type.equals(original.getType())) {
          lowered = Variable.parameter(original.getName(), type);
          closure.setLoweredParameter(original, lowered);
        }
        parameters.add(lowered);
      }

      List<ClosureEnvironment> refEnvironments = new ArrayList<>();
      for (ClosureEnvironment env : closure.getCapturedEnvironments()) {
        if (env.isValueType()) {
          refEnvironments.add(env);
        }
      }
      refEnvironments.sort(REF_PARAMETER_ORDER);
      closure.setRefParameterEnvironments(refEnvironments);
      for (ClosureEnvironment env : refEnvironments) {
        parameters.add(
            Variable.syntheticRefParameter(
                ENVIRONMENT_LOCAL_PREFIX + env.getIndex(), environmentTypeIn(env, substitution)));
      }

      String name =
          closure.isLambda()
              ? names.getUniqueName(methodName + options.getLambdaMethodInfix())
              : names.getUniqueName(methodName + "$" + symbol.getName() + "$");
      SynthesizedMethod lowered =
          new SynthesizedMethod(
              name,
              symbol,
              containing == null ? null : containing.getSynthesizedType(),
              method.getOwnerType(),
              isStatic(tree, closure),
              typeParameters.build(),
              parameters.build(),
              symbol.getReturnType().substitute(substitution));
      closure.setLoweredMethod(lowered);
      if (containing != null) {
        containing.getSynthesizedType().addMethod(lowered);
      }
    }
  }

  /** Type parameters of the method and of every local function enclosing or owning {@code s}. */
  private List<String> typeParametersInScope(Scope s) {
    List<FunctionSymbol> functions = new ArrayList<>();
    for (Scope scope = s; scope != null; scope = scope.getParent()) {
      if (scope.isNestedFunctionBody()) {
        functions.add(0, scope.getFunction().getSymbol());
      }
    }
    List<String> typeParameters = new ArrayList<>(tree.getMethodSymbol().getTypeParameters());
    for (FunctionSymbol function : functions) {
      typeParameters.addAll(function.getTypeParameters());
    }
    return typeParameters;
  }

  private static Map<String, TypeRef> renamingOf(ClosureEnvironment env) {
    Map<String, TypeRef> substitution = new LinkedHashMap<>();
    for (String typeParameter : env.getSourceTypeParameters()) {
      substitution.put(typeParameter, TypeRef.typeParameter(TYPE_PARAMETER_PREFIX + typeParameter));
    }
    return substitution;
  }
}
