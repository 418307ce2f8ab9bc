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
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Storage layout of a tensor, one mode format per mode.  Opaque to the
 * notation passes, which only pass it along.
 */
public class Format {
  private final ImmutableList<ModeFormat> modeFormats;

  public Format(List<ModeFormat> modeFormats) {
    this.modeFormats = ImmutableList.copyOf(modeFormats);
  }

  public Format(ModeFormat... modeFormats) {
    this(Arrays.asList(modeFormats));
  }

  /**
   * All-dense format for a tensor of the given order
   */
  public static Format dense(int order) {
    return new Format(Collections.nCopies(order, ModeFormat.DENSE));
  }

  public List<ModeFormat> getModeFormats() {
    return modeFormats;
  }

  public int getOrder() {
    return modeFormats.size();
  }

  @Override
  public int hashCode() {
    return modeFormats.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Format)) {
      return false;
    }
    return modeFormats.equals(((Format)obj).modeFormats);
  }

  @Override
  public String toString() {
    return "(" + StringUtils.join(modeFormats, ",").toLowerCase() + ")";
  }
}
