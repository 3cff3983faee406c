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
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Table;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.loopform.ir.IrType.Kind;

/**
 * The host compiler's registry of built-in types, and of the library functions that for-loop
 * idioms are written with.
 *
 * <p>Each BuiltIns instance has its own set of {@link IrType}s, and since IrTypes are compared by
 * identity, IR built against one BuiltIns must not be mixed with IR built against another.
 *
 * <p>A BuiltIns may be shared by concurrent compilations; {@link #arrayOf} is the only method that
 * adds types after construction, and it is safe to call from any thread.
 */
public final class BuiltIns {

  public static final String RANGES_PACKAGE = "kotlin.ranges";
  public static final String COLLECTIONS_PACKAGE = "kotlin.collections";

  public final IrType anyType = IrType.newClass("kotlin.Any");
  public final IrType booleanType = primitive("kotlin.Boolean");
  public final IrType byteType = primitive("kotlin.Byte");
  public final IrType shortType = primitive("kotlin.Short");
  public final IrType intType = primitive("kotlin.Int");
  public final IrType longType = primitive("kotlin.Long");
  public final IrType charType = primitive("kotlin.Char");

  /** The (erased) type returned by every {@code iterator()} function. */
  public final IrType iteratorType = IrType.newClass(COLLECTIONS_PACKAGE + ".Iterator");

  /** The (erased) type returned by {@code Array<T>.reversed()}. */
  public final IrType listType = IrType.newClass(COLLECTIONS_PACKAGE + ".List");

  public final IrType intProgression = progression("IntProgression", intType);
  public final IrType intRange = progression("IntRange", intType);
  public final IrType longProgression = progression("LongProgression", longType);
  public final IrType longRange = progression("LongRange", longType);
  public final IrType charProgression = progression("CharProgression", charType);
  public final IrType charRange = progression("CharRange", charType);

  /** The types whose values may be the elements of an optimizable progression. */
  public final ImmutableSet<IrType> progressionElementTypes =
      ImmutableSet.of(byteType, shortType, intType, longType, charType);

  /** The built-in progression classes. */
  public final ImmutableSet<IrType> progressionClassTypes =
      ImmutableSet.of(
          intProgression, intRange, longProgression, longRange, charProgression, charRange);

  private final Map<IrType, IrType> primitiveArrays = new IdentityHashMap<>();
  // Written by arrayOf, which may run concurrently.
  private final Map<IrType, IrType> genericArrays = new ConcurrentHashMap<>();

  private final Table<IrType, IrType, FunctionSymbol> downToFunctions = HashBasedTable.create();
  private final Table<IrType, IrType, FunctionSymbol> untilFunctions = HashBasedTable.create();
  private final Map<IrType, FunctionSymbol> reversedFunctions = new IdentityHashMap<>();
  private final Map<IrType, FunctionSymbol> indicesGetters = new ConcurrentHashMap<>();
  private final Map<IrType, FunctionSymbol> arrayReversedFunctions = new ConcurrentHashMap<>();
  private final Map<IrType, FunctionSymbol> reversedArrayFunctions = new ConcurrentHashMap<>();

  public BuiltIns() {
    listType.declareFunction("iterator", iteratorType, ImmutableList.of());
    for (IrType type : ImmutableList.of(byteType, shortType, intType, longType)) {
      IrType negated = (type == longType) ? longType : intType;
      type.declareFunction("unaryMinus", negated, ImmutableList.of());
    }
    for (IrType receiver : progressionElementTypes) {
      for (IrType arg : progressionElementTypes) {
        if ((receiver == charType) != (arg == charType)) {
          // Chars only form progressions with other Chars.
          continue;
        }
        IrType elementType = widen(receiver, arg);
        receiver.declareFunction("rangeTo", rangeOf(elementType), ImmutableList.of(arg));
        downToFunctions.put(
            receiver,
            arg,
            FunctionSymbol.extension(
                RANGES_PACKAGE + ".downTo", progressionOf(elementType), receiver, arg));
        untilFunctions.put(
            receiver,
            arg,
            FunctionSymbol.extension(
                RANGES_PACKAGE + ".until", rangeOf(elementType), receiver, arg));
      }
    }
    for (IrType progression : progressionClassTypes) {
      progression.declareFunction("iterator", iteratorType, ImmutableList.of());
      reversedFunctions.put(
          progression,
          FunctionSymbol.extension(
              RANGES_PACKAGE + ".reversed",
              progressionOf(progression.elementType),
              progression));
    }
    for (IrType element :
        ImmutableList.of(booleanType, byteType, shortType, intType, longType, charType)) {
      IrType array =
          new IrType("kotlin." + element.simpleName() + "Array", Kind.PRIMITIVE_ARRAY, element);
      declareArrayMembers(array);
      primitiveArrays.put(element, array);
    }
  }

  private static IrType primitive(String fqName) {
    return new IrType(fqName, Kind.PRIMITIVE, null);
  }

  private static IrType progression(String simpleName, IrType elementType) {
    return new IrType(RANGES_PACKAGE + "." + simpleName, Kind.PROGRESSION, elementType);
  }

  /** The element type of a progression formed from a receiver and argument of these types. */
  private IrType widen(IrType receiver, IrType arg) {
    if (receiver == charType) {
      return charType;
    }
    return (receiver == longType || arg == longType) ? longType : intType;
  }

  /** Returns the {@code XRange} class whose elements have the given (widened) type. */
  public IrType rangeOf(IrType elementType) {
    if (elementType == longType) {
      return longRange;
    } else if (elementType == charType) {
      return charRange;
    }
    return intRange;
  }

  /** Returns the {@code XProgression} class whose elements have the given (widened) type. */
  public IrType progressionOf(IrType elementType) {
    if (elementType == longType) {
      return longProgression;
    } else if (elementType == charType) {
      return charProgression;
    }
    return intProgression;
  }

  private void declareArrayMembers(IrType array) {
    array.declareProperty("size", intType);
    array.declareFunction("iterator", iteratorType, ImmutableList.of());
    array.declareFunction("get", array.elementType, ImmutableList.of(intType));
    indicesGetters.put(
        array, FunctionSymbol.extensionProperty(COLLECTIONS_PACKAGE, "indices", intRange, array));
    arrayReversedFunctions.put(
        array, FunctionSymbol.extension(COLLECTIONS_PACKAGE + ".reversed", listType, array));
    reversedArrayFunctions.put(
        array, FunctionSymbol.extension(COLLECTIONS_PACKAGE + ".reversedArray", array, array));
  }

  /** Returns the primitive array type (e.g. {@code IntArray}) for the given primitive type. */
  public IrType primitiveArrayOf(IrType elementType) {
    IrType result = primitiveArrays.get(elementType);
    Preconditions.checkArgument(result != null, "No primitive array of %s", elementType);
    return result;
  }

  /** Returns the instantiation of {@code Array<T>} for the given element type. */
  public IrType arrayOf(IrType elementType) {
    return genericArrays.computeIfAbsent(
        elementType,
        e -> {
          IrType array = new IrType("kotlin.Array", Kind.ARRAY, e);
          declareArrayMembers(array);
          return array;
        });
  }

  /** The {@code rangeTo} member of {@code receiver} that accepts an {@code arg}, if any. */
  public @Nullable FunctionSymbol rangeTo(IrType receiver, IrType arg) {
    return receiver.function("rangeTo", arg);
  }

  /** The {@code kotlin.ranges.downTo} overload for the given types, if any. */
  public @Nullable FunctionSymbol downTo(IrType receiver, IrType arg) {
    return downToFunctions.get(receiver, arg);
  }

  /** The {@code kotlin.ranges.until} overload for the given types, if any. */
  public @Nullable FunctionSymbol until(IrType receiver, IrType arg) {
    return untilFunctions.get(receiver, arg);
  }

  /** The {@code kotlin.ranges.reversed} extension on the given progression class, if any. */
  public @Nullable FunctionSymbol reversed(IrType progression) {
    return reversedFunctions.get(progression);
  }

  /** The getter of the {@code indices} extension property on the given array type, if any. */
  public @Nullable FunctionSymbol indices(IrType array) {
    return indicesGetters.get(array);
  }

  /** The {@code kotlin.collections.reversed} extension on the given array type, if any. */
  public @Nullable FunctionSymbol arrayReversed(IrType array) {
    return arrayReversedFunctions.get(array);
  }

  /** The {@code kotlin.collections.reversedArray} extension on the given array type, if any. */
  public @Nullable FunctionSymbol reversedArray(IrType array) {
    return reversedArrayFunctions.get(array);
  }
}
