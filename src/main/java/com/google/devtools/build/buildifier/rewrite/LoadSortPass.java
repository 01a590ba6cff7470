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


package com.google.devtools.build.buildifier.rewrite;

import com.google.common.collect.ImmutableList;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.LoadStatement;
import com.google.devtools.build.buildifier.syntax.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes load statements: a symbol loaded twice under the same name is loaded once, and the
 * symbols are sorted by the name they are bound to.
 */
final class LoadSortPass implements RewritePass {

  private static final Comparator<LoadStatement.Binding> ORDER =
      Comparator.comparing(LoadStatement.Binding::getLocalName);

  @Override
  public String name() {
    return "loadsort";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (Statement stmt : file.getStatements()) {
      if (stmt.kind() != Statement.Kind.LOAD) {
        continue;
      }
      LoadStatement load = (LoadStatement) stmt;
      Map<String, LoadStatement.Binding> seen = new HashMap<>();
      List<LoadStatement.Binding> bindings = new ArrayList<>();
      for (LoadStatement.Binding binding : load.getBindings()) {
        String key = binding.getLocalName() + "=" + binding.getOriginalName();
        LoadStatement.Binding first = seen.putIfAbsent(key, binding);
        if (first != null) {
          first.absorbComments(binding);
        } else {
          bindings.add(binding);
        }
      }
      bindings.sort(ORDER);
      if (!bindings.equals(load.getBindings())) {
        load.setBindings(ImmutableList.copyOf(bindings));
        changes.add(load.getImport().getValue());
      }
    }
    return changes.build();
  }
}
