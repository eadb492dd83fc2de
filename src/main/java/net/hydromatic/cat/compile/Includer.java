/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cat.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.parse.CatParseException;
import net.hydromatic.cat.parse.Parsers;
import net.hydromatic.cat.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces {@code include} directives with the definitions of the files they
 * name.
 *
 * <p>A relative path is looked up in the directory of the including file,
 * then in each search directory in turn. Each file is included at most once;
 * a later include of a file that has already been spliced in is ignored. A
 * file that includes itself, directly or indirectly, is an error. So is a
 * file that does not parse; the error is reported at the {@code include},
 * and its cause is the {@link CatParseException}.
 */
public class Includer {
  private final List<File> searchPath;
  private final Tracer tracer;
  /** Files currently being included, innermost last. */
  private final Deque<File> stack = new ArrayDeque<>();
  /** Files that have been included. */
  private final Set<File> done = new HashSet<>();

  public Includer(List<File> searchPath, Tracer tracer) {
    this.searchPath = ImmutableList.copyOf(searchPath);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the definitions of a file, with includes expanded. */
  public List<Ast.Def<Unit>> expand(Ast.ParseCat<Unit> parseCat) {
    final ImmutableList.Builder<Ast.Def<Unit>> defs = ImmutableList.builder();
    expand(parseCat, defs);
    return defs.build();
  }

  private void expand(Ast.ParseCat<Unit> parseCat,
      ImmutableList.Builder<Ast.Def<Unit>> defs) {
    for (Ast.ParseDef<Unit> parseDef : parseCat.defs) {
      if (parseDef instanceof Ast.Include) {
        include((Ast.Include<Unit>) parseDef, parseCat.directory, defs);
      } else {
        defs.add((Ast.Def<Unit>) parseDef);
      }
    }
  }

  private void include(Ast.Include<Unit> include, @Nullable File directory,
      ImmutableList.Builder<Ast.Def<Unit>> defs) {
    final File file = find(include, directory);
    final File canonical = canonical(file, include);
    if (stack.contains(canonical)) {
      throw new ResolveException(ResolveException.Kind.INCLUDE_CYCLE,
          include.path, include.pos);
    }
    if (!done.add(canonical)) {
      return;
    }
    tracer.onInclude(file);
    final Ast.ParseCat<Unit> parseCat;
    try {
      parseCat = Parsers.parseFile(file);
    } catch (IOException e) {
      final ResolveException e2 =
          new ResolveException(ResolveException.Kind.INCLUDE_NOT_FOUND,
              include.path, include.pos);
      e2.initCause(e);
      throw e2;
    } catch (CatParseException e) {
      final ResolveException e2 =
          new ResolveException(ResolveException.Kind.INCLUDE_PARSE_ERROR,
              include.path, include.pos);
      e2.initCause(e);
      throw e2;
    }
    stack.push(canonical);
    try {
      expand(parseCat, defs);
    } finally {
      stack.pop();
    }
  }

  /** Finds the file named by an include directive. */
  private File find(Ast.Include<Unit> include, @Nullable File directory) {
    final File file = new File(include.path);
    if (file.isAbsolute()) {
      if (file.isFile()) {
        return file;
      }
    } else {
      if (directory != null) {
        final File f = child(directory, include.path);
        if (f.isFile()) {
          return f;
        }
      }
      for (File dir : searchPath) {
        final File f = child(dir, include.path);
        if (f.isFile()) {
          return f;
        }
      }
    }
    throw new ResolveException(ResolveException.Kind.INCLUDE_NOT_FOUND,
        include.path, include.pos);
  }

  /** Returns a file in a directory; the empty directory denotes the current
   * directory, not the root. */
  private static File child(File directory, String path) {
    return directory.getPath().isEmpty()
        ? new File(path)
        : new File(directory, path);
  }

  private static File canonical(File file, Ast.Include<Unit> include) {
    try {
      return file.getCanonicalFile();
    } catch (IOException e) {
      final ResolveException e2 =
          new ResolveException(ResolveException.Kind.INCLUDE_NOT_FOUND,
              include.path, include.pos);
      e2.initCause(e);
      throw e2;
    }
  }
}

// End Includer.java
