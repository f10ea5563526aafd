package com.raditha.extract.refactoring;

import java.util.List;

/**
 * Statements of the generated method body, unindented.
 *
 * @param statements Statement texts in order; a statement may span several lines
 * @param labeled    True when the selection was wrapped in a labeled block
 */
public record TransformedBody(List<String> statements, boolean labeled) {

    public TransformedBody {
        statements = List.copyOf(statements);
    }
}
