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

package exm.tnc.common.exceptions;

/**
 * Internal error in the notation compiler.  These always indicate a bug in
 * the compiler or a caller that broke an API contract, for example casting a
 * node to the wrong variant or passing an undefined handle.
 * */
public class TNCRuntimeError extends RuntimeException
{
  public TNCRuntimeError(String msg)
  {
    super(msg);
  }

  public TNCRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
