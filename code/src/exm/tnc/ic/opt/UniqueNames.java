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

import java.util.HashSet;
import java.util.Set;

import exm.tnc.common.Settings;
import exm.tnc.common.lang.IndexVar;
import exm.tnc.common.lang.TensorVar;
import exm.tnc.common.lang.Type;
import exm.tnc.ic.tree.IndexNotation;
import exm.tnc.ic.tree.NotationStmts.IndexStmt;

/**
 * Generate names for tensors introduced by a pass that don't clash with
 * the tensors already in a statement.
 */
class UniqueNames {
  private final Set<String> used = new HashSet<String>();

  UniqueNames(IndexStmt stmt) {
    for (TensorVar tensor: IndexNotation.getTensorVars(stmt)) {
      used.add(tensor.getName());
    }
  }

  String uniqueName(String name) {
    String unique = name;
    int next = 1;
    while (used.contains(unique)) {
      unique = name + "_" + next;
      next++;
    }
    used.add(unique);
    return unique;
  }

  /**
   * Scalar temporary holding a reduction over var
   */
  TensorVar createTemporary(IndexVar var, Type type) {
    String prefix = Settings.get(Settings.TEMPORARY_PREFIX);
    return new TensorVar(uniqueName(prefix + var.getName()), type);
  }

  /**
   * Workspace for an operator split of var
   */
  TensorVar createWorkspace(IndexVar var, Type type) {
    String prefix = Settings.get(Settings.WORKSPACE_PREFIX);
    return new TensorVar(uniqueName(prefix + var.getName()), type);
  }
}
