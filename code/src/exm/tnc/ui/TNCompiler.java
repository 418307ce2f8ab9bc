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
package exm.tnc.ui;

import java.io.PrintStream;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.tnc.common.exceptions.TNCFatal;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.ic.opt.NotationLowering;
import exm.tnc.ic.tree.NotationStmts.Assignment;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * This is the main entry point to the compiler
 */
public class TNCompiler {

  private final Logger logger;

  public TNCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Build a kernel and lower it to concrete notation.
   * @param kernel name of kernel in {@link Kernels}
   * @param stages if not null, print the statement after every pass
   * @return the concrete statement
   * @throws TNCFatal with the exit code if lowering fails
   */
  public IndexStmt compile(String kernel, PrintStream stages) {
    try {
      logger.debug("Building kernel " + kernel);
      Assignment assignment = Kernels.build(kernel);
      IndexStmt result = NotationLowering.lower(logger, stages, assignment);
      logger.debug("Lowered kernel " + kernel);
      return result;
    }
    catch (TNCFatal e) {
      // Rethrow
      throw e;
    }
    catch (UserException e) {
      System.err.println("tnc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new TNCFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new TNCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("TNC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
