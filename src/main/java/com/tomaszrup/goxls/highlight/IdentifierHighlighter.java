////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.goxls.highlight;

import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.Inspector;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.ast.Visit;
import com.tomaszrup.goxls.types.SemanticInfo;
import com.tomaszrup.goxls.types.SemanticObject;

/**
 * Highlights every occurrence of the entity an identifier denotes, across the
 * whole file. Identifiers without a binding are grouped by name.
 */
public final class IdentifierHighlighter {
    private final SemanticInfo info;

    public IdentifierHighlighter(SemanticInfo info) {
        this.info = info;
    }

    public void identifier(Ident id, SourceFile file, HighlightSet result) {
        SemanticObject object = info.objectOf(id);
        Inspector.inspect(file, node -> {
            if (node instanceof Ident) {
                Ident other = (Ident) node;
                if (other.getName().equals(id.getName()) && info.objectOf(other) == object) {
                    result.add(other);
                }
            } else if (node instanceof ImportSpec) {
                ImportSpec spec = (ImportSpec) node;
                if (info.importedPackageName(spec) == object) {
                    result.add(spec.getName() != null ? spec.getName() : spec);
                }
            }
            return Visit.CONTINUE;
        });
    }

    /**
     * Highlights an import and every reference to the package name it
     * declares.
     */
    public void importSpec(ImportSpec spec, SourceFile file, HighlightSet result) {
        result.add(spec);
        SemanticObject packageName = info.importedPackageName(spec);
        if (packageName == null) {
            return;
        }
        Inspector.inspect(file, node -> {
            if (node instanceof Ident && info.getUse((Ident) node) == packageName) {
                result.add(node);
            }
            return Visit.CONTINUE;
        });
    }
}
