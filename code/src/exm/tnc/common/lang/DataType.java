/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.tnc.common.lang;

/**
 * Component types of tensors and literals
 */
public enum DataType {
  BOOL(Kind.BOOL, 8),
  UINT32(Kind.UINT, 32),
  UINT64(Kind.UINT, 64),
  INT32(Kind.INT, 32),
  INT64(Kind.INT, 64),
  FLOAT32(Kind.FLOAT, 32),
  FLOAT64(Kind.FLOAT, 64),
  COMPLEX64(Kind.COMPLEX, 64),
  COMPLEX128(Kind.COMPLEX, 128);

  /**
   * Ordered from narrowest to widest for the purpose of promotion
   */
  public static enum Kind {
    BOOL, UINT, INT, FLOAT, COMPLEX
  }

  private final Kind kind;
  private final int bits;

  private DataType(Kind kind, int bits) {
    this.kind = kind;
    this.bits = bits;
  }

  public Kind getKind() {
    return kind;
  }

  public int getNumBits() {
    return bits;
  }

  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  public boolean isUInt() {
    return kind == Kind.UINT;
  }

  public boolean isInt() {
    return kind == Kind.INT;
  }

  public boolean isFloat() {
    return kind == Kind.FLOAT;
  }

  public boolean isComplex() {
    return kind == Kind.COMPLEX;
  }

  /**
   * Type that the result of combining values of both types is promoted to:
   * the wider kind wins, then the wider width.
   */
  public static DataType max(DataType a, DataType b) {
    int cmp = a.kind.compareTo(b.kind);
    if (cmp != 0) {
      return cmp > 0 ? a : b;
    }
    return a.bits >= b.bits ? a : b;
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
