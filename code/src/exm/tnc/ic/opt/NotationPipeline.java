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
package exm.tnc.ic.opt;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.tnc.common.Settings;
import exm.tnc.common.exceptions.InvalidOptionException;
import exm.tnc.common.exceptions.TNCRuntimeError;
import exm.tnc.common.exceptions.UserException;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

public class NotationPipeline {

  /**
   * @param output if not null, print statement after each pass
   * @param validator if not null, run after each pass
   */
  public NotationPipeline(PrintStream output, NotationPass validator) {
    this.output = output;
    this.validator = validator;
  }

  private final List<NotationPass> passes = new ArrayList<NotationPass>();
  private final PrintStream output;
  private final NotationPass validator;

  public void addPass(NotationPass pass) {
    passes.add(pass);
  }

  public List<NotationPass> getPasses() {
    return passes;
  }

  public IndexStmt runPipeline(Logger logger, IndexStmt stmt)
                                              throws UserException {
    IndexStmt curr = stmt;
    for (NotationPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        curr = pass.apply(logger, curr);
        if (output != null) {
          output.println(pass.getPassName() + ": " + curr);
        }
        if (validator != null) {
          validator.apply(logger, curr);
        }
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
    return curr;
  }

  public boolean passEnabled(NotationPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new TNCRuntimeError("Expected config key " +
                        pass.getConfigEnabledKey() + " to exist", e);
    }
  }
}
