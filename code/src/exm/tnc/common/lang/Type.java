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

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Tensor type: the component type and the dimension of each mode.  A type
 * with no dimensions is a scalar.
 */
public class Type {
  private final DataType dataType;
  private final ImmutableList<Dimension> shape;

  public Type(DataType dataType, List<Dimension> shape) {
    if (dataType == null) {
      throw new IllegalArgumentException("undefined data type");
    }
    this.dataType = dataType;
    this.shape = ImmutableList.copyOf(shape);
  }

  public Type(DataType dataType, Dimension... shape) {
    this(dataType, Arrays.asList(shape));
  }

  public static Type scalar(DataType dataType) {
    return new Type(dataType, ImmutableList.<Dimension>of());
  }

  /**
   * Convenience for tensors where all dimensions are fixed
   */
  public static Type fixed(DataType dataType, long... sizes) {
    ImmutableList.Builder<Dimension> dims = ImmutableList.builder();
    for (long size: sizes) {
      dims.add(Dimension.fixed(size));
    }
    return new Type(dataType, dims.build());
  }

  public DataType getDataType() {
    return dataType;
  }

  public List<Dimension> getShape() {
    return shape;
  }

  public Dimension getDimension(int mode) {
    return shape.get(mode);
  }

  public int getOrder() {
    return shape.size();
  }

  @Override
  public int hashCode() {
    return 31 * dataType.hashCode() + shape.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Type)) {
      return false;
    }
    Type other = (Type)obj;
    return dataType == other.dataType && shape.equals(other.shape);
  }

  @Override
  public String toString() {
    if (shape.isEmpty()) {
      return dataType.toString();
    }
    return dataType + "[" + StringUtils.join(shape, ",") + "]";
  }
}
