/*
 * Copyright 2025 The Retrospect Authors
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

package org.loopform.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An IrType is the statically-resolved type of an {@link IrExpression}. IrTypes are compared by
 * identity; each {@link BuiltIns} instance creates exactly one IrType for each type it knows about
 * (including each instantiation of the generic {@code Array<T>}).
 *
 * <p>An IrType also owns the members that the lowering pass needs to resolve by name: member
 * functions (e.g. {@code unaryMinus}) and properties (e.g. {@code size}). Member functions may be
 * overloaded. Members are declared while the owning BuiltIns is being set up and never change
 * afterwards.
 */
public final class IrType {

  /** The broad category of a type. */
  public enum Kind {
    /** A primitive value type such as {@code Int} or {@code Char}. */
    PRIMITIVE,
    /** A specialized array of primitives such as {@code IntArray}. */
    PRIMITIVE_ARRAY,
    /** An instantiation of the generic {@code Array<T>}. */
    ARRAY,
    /** One of the built-in progression classes, e.g. {@code IntRange}. */
    PROGRESSION,
    /** Any other class. */
    CLASS
  }

  /** The fully-qualified name of this type, e.g. {@code "kotlin.IntArray"}. */
  public final String fqName;

  public final Kind kind;

  /**
   * For arrays and progressions, the type of their elements; null for all other types.
   *
   * <p>(The elements of a progression are always primitive; the elements of an {@code Array<T>}
   * may be any type.)
   */
  public final @Nullable IrType elementType;

  private final ListMultimap<String, FunctionSymbol> functions = LinkedListMultimap.create();
  private final Map<String, FunctionSymbol> propertyGetters = new LinkedHashMap<>();

  IrType(String fqName, Kind kind, @Nullable IrType elementType) {
    Preconditions.checkArgument(
        (elementType != null) == (kind != Kind.PRIMITIVE && kind != Kind.CLASS),
        "Bad element type for %s",
        fqName);
    this.fqName = fqName;
    this.kind = kind;
    this.elementType = elementType;
  }

  /** Creates a new user-defined class type with no members. */
  public static IrType newClass(String fqName) {
    return new IrType(fqName, Kind.CLASS, null);
  }

  /** True if this is a primitive array or an {@code Array<T>}. */
  public boolean isArrayOrPrimitiveArray() {
    return kind == Kind.ARRAY || kind == Kind.PRIMITIVE_ARRAY;
  }

  /** The last segment of {@link #fqName}. */
  public String simpleName() {
    return FunctionSymbol.lastSegment(fqName);
  }

  /**
   * Declares a member function on this type and returns its symbol. The new function's dispatch
   * receiver is this type.
   */
  public FunctionSymbol declareFunction(
      String name, IrType returnType, ImmutableList<IrType> parameterTypes) {
    FunctionSymbol fn =
        new FunctionSymbol(
            fqName + "." + name,
            returnType,
            this,
            null,
            parameterTypes,
            /* isPropertyGetter= */ false);
    functions.put(name, fn);
    return fn;
  }

  /** Declares a member property on this type and returns the symbol for its getter. */
  public FunctionSymbol declareProperty(String name, IrType type) {
    FunctionSymbol getter =
        new FunctionSymbol(
            fqName + ".<get-" + name + ">",
            type,
            this,
            null,
            ImmutableList.of(),
            /* isPropertyGetter= */ true);
    FunctionSymbol prev = propertyGetters.putIfAbsent(name, getter);
    Preconditions.checkState(prev == null, "%s already declared on %s", name, this);
    return getter;
  }

  /**
   * Returns the first-declared member function with the given name, or null if there is none.
   */
  public @Nullable FunctionSymbol function(String name) {
    List<FunctionSymbol> overloads = functions.get(name);
    return overloads.isEmpty() ? null : overloads.get(0);
  }

  /** Returns the overload of the named member function with the given parameter types, if any. */
  public @Nullable FunctionSymbol function(String name, IrType... parameterTypes) {
    ImmutableList<IrType> params = ImmutableList.copyOf(parameterTypes);
    return functions.get(name).stream()
        .filter(f -> f.parameterTypes.equals(params))
        .findFirst()
        .orElse(null);
  }

  /** Returns the getter of the member property with the given name, or null if there is none. */
  public @Nullable FunctionSymbol propertyGetter(String name) {
    return propertyGetters.get(name);
  }

  @Override
  public String toString() {
    if (kind == Kind.ARRAY) {
      return "Array<" + elementType + ">";
    }
    return simpleName();
  }
}
