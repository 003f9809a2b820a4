package me.christianrobert.orapgroutines.transformer.model.statement;

/**
 * Exhaustive dispatch over statement variants.
 *
 * <p>Adding a variant adds a method here, so every analyzer and rewriter pass fails to
 * compile until it handles the new case.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

    R visitOpen(OpenStatement statement);

    R visitClose(CloseStatement statement);

    R visitFetch(FetchStatement statement);

    R visitModifying(ModifyingStatement statement);

    R visitOther(OtherStatement statement);

    R visitBlock(BlockStatement statement);
}
