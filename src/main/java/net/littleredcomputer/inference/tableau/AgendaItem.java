package net.littleredcomputer.inference.tableau;

import net.littleredcomputer.logic.Expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * A formula waiting on a branch's agenda, with the bookkeeping the reusable rules need: the
 * terms a universal has already been instantiated with, and whether the item has nothing
 * left to contribute until the branch changes.
 */
public final class AgendaItem {
    private final Expression expression;
    private final Category category;
    private final Set<Expression> usedWith;
    private boolean exhausted;

    AgendaItem(Expression expression) {
        this(expression, Category.of(expression), new LinkedHashSet<>(), false);
    }

    private AgendaItem(Expression expression, Category category, Set<Expression> usedWith, boolean exhausted) {
        this.expression = expression;
        this.category = category;
        this.usedWith = usedWith;
        this.exhausted = exhausted;
    }

    public Expression expression() { return expression; }

    public Category category() { return category; }

    public Set<Expression> usedWith() { return Collections.unmodifiableSet(usedWith); }

    public boolean isExhausted() { return exhausted; }

    void use(Expression term) { usedWith.add(term); }

    void markExhausted() { exhausted = true; }

    void refresh() { exhausted = false; }

    AgendaItem copy() {
        return new AgendaItem(expression, category, new LinkedHashSet<>(usedWith), exhausted);
    }

    /**
     * @return an item for the rewritten expression, carrying this item's flags with the
     * used terms rewritten the same way
     */
    AgendaItem map(UnaryOperator<Expression> f) {
        Expression e = f.apply(expression);
        Set<Expression> used = new LinkedHashSet<>();
        for (Expression u : usedWith) used.add(f.apply(u));
        if (e.equals(expression) && used.equals(usedWith)) return this;
        return new AgendaItem(e, Category.of(e), used, exhausted);
    }

    @Override
    public String toString() {
        if (category.isReusable()) return expression + ": " + usedWith + (exhausted ? " (exhausted)" : "");
        return expression.toString();
    }
}
