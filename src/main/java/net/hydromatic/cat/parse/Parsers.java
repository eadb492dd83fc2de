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
package net.hydromatic.cat.parse;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for parsing cat source. */
public abstract class Parsers {
  private Parsers() {}

  /** Parses the text of a cat file. Relative include paths will be resolved
   * against {@code directory}, if it is not null. */
  public static Ast.ParseCat<Unit> parse(
      String text, @Nullable File directory) {
    final CatParserImpl parser = new CatParserImpl(new StringReader(text));
    parser.zero("", directory);
    return parser.parseCatSafe();
  }

  /** Reads and parses a cat file. Positions carry the file's path, and
   * relative include paths are resolved against its directory. */
  public static Ast.ParseCat<Unit> parseFile(File file) throws IOException {
    final String text = Files.readString(file.toPath(), UTF_8);
    final File absolute = file.getAbsoluteFile();
    final CatParserImpl parser = new CatParserImpl(new StringReader(text));
    parser.zero(file.getPath(), absolute.getParentFile());
    return parser.parseCatSafe();
  }

  /** Parses an expression. */
  public static Ast.Exp<Unit> parseExp(String text) {
    final CatParserImpl parser = new CatParserImpl(new StringReader(text));
    parser.zero("", null);
    return parser.expressionSafe();
  }
}

// End Parsers.java
