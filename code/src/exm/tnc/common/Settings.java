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

package exm.tnc.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.tnc.common.exceptions.InvalidOptionException;
import exm.tnc.common.exceptions.TNCRuntimeError;

/**
 * General compiler settings.
 *
 * Defaults are set here and can be overridden through Java system
 * properties with the same key, or directly with {@link #set}.
 * */
public class Settings
{
  public static final String OPT_SPLIT_OPERATORS = "tnc.opt.split-operators";
  public static final String OPT_SIMPLIFY = "tnc.opt.simplify";

  /** Validate statement after every lowering pass */
  public static final String COMPILER_DEBUG = "tnc.compiler-debug";

  /** Name prefix of temporaries introduced for nested reductions */
  public static final String TEMPORARY_PREFIX = "tnc.temporary-prefix";
  /** Name prefix of workspaces introduced by operator splits */
  public static final String WORKSPACE_PREFIX = "tnc.workspace-prefix";

  public static final String LOG_FILE = "tnc.log.file";
  public static final String LOG_TRACE = "tnc.log.trace";

  /** Kernel to build in the command line driver */
  public static final String KERNEL = "tnc.kernel";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_SPLIT_OPERATORS, "true");
    defaults.setProperty(OPT_SIMPLIFY, "true");
    defaults.setProperty(COMPILER_DEBUG, "true");
    defaults.setProperty(TEMPORARY_PREFIX, "t");
    defaults.setProperty(WORKSPACE_PREFIX, "w");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(KERNEL, "matmul");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initTNCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set for key, reverting to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_SPLIT_OPERATORS);
    getBoolean(OPT_SIMPLIFY);
    getBoolean(COMPILER_DEBUG);
    getBoolean(LOG_TRACE);
    checkNonEmpty(TEMPORARY_PREFIX);
    checkNonEmpty(WORKSPACE_PREFIX);
    checkOneOf(KERNEL, Arrays.asList("matmul", "spmv", "mttkrp", "ttv",
                                     "add", "inner", "residual"));
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  private static void checkNonEmpty(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.length() == 0) {
      throw new InvalidOptionException("Expected non-empty value for " +
                                       "property " + key);
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  /**
   * For use inside passes, where a bad option is an internal error
   * since options are validated up front.
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new TNCRuntimeError(e.getMessage(), e);
    }
  }
}
