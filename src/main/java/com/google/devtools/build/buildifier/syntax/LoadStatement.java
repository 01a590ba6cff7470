// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.


package com.google.devtools.build.buildifier.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for an import statement. */
public final class LoadStatement extends Statement {

  /**
   * Binding represents a binding in a load statement. load("...", local = "orig")
   *
   * <p>If there's no alias, a single Identifier can be used for both local and orig.
   */
  public static final class Binding extends Node {
    @Nullable private final Identifier local;
    private final StringLiteral orig;

    Binding(FileLocations locs, @Nullable Identifier local, StringLiteral orig) {
      super(locs);
      this.local = local;
      this.orig = orig;
    }

    /** Returns the name under which the symbol is bound in the loading file. */
    public String getLocalName() {
      return local != null ? local.getName() : orig.getValue();
    }

    /** Returns the name of the symbol in the loaded file. */
    public String getOriginalName() {
      return orig.getValue();
    }

    /** Returns the alias, or null if the binding has the form {@code "sym"}. */
    @Nullable
    public Identifier getLocal() {
      return local;
    }

    /** Returns the string literal naming the loaded symbol. */
    public StringLiteral getOriginal() {
      return orig;
    }

    @Override
    public int getStartOffset() {
      return local != null ? local.getStartOffset() : orig.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return orig.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int loadOffset;
  private final StringLiteral module;
  private ImmutableList<Binding> bindings;
  private final int rparenOffset;
  private boolean forceMultiLine;

  /**
   * Constructs an import statement.
   *
   * <p>{@code bindings} maps a symbol to its alias, if any. Aliases are exposed to the loading file.
   */
  LoadStatement(
      FileLocations locs,
      int loadOffset,
      StringLiteral module,
      ImmutableList<Binding> bindings,
      int rparenOffset) {
    super(locs);
    this.loadOffset = loadOffset;
    this.module = module;
    this.bindings = bindings;
    this.rparenOffset = rparenOffset;
  }

  public ImmutableList<Binding> getBindings() {
    return bindings;
  }

  public void setBindings(ImmutableList<Binding> bindings) {
    Preconditions.checkArgument(!bindings.isEmpty(), "load statement without symbols");
    this.bindings = bindings;
  }

  public StringLiteral getImport() {
    return module;
  }

  /** Reports whether the closing parenthesis was on a later line than the opening one. */
  public boolean isForceMultiLine() {
    return forceMultiLine;
  }

  public void setForceMultiLine(boolean forceMultiLine) {
    this.forceMultiLine = forceMultiLine;
  }

  @Override
  public int getStartOffset() {
    return loadOffset;
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.LOAD;
  }
}
