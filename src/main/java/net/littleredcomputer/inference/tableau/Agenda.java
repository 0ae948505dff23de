package net.littleredcomputer.inference.tableau;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.Variable;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The formulas still to be expanded on one branch, bucketed by {@link Category}. Within a
 * bucket, items are served in insertion order; a formula is held at most once per agenda.
 * <p>
 * An agenda is mutable and belongs to exactly one branch. When a branch splits, each side
 * gets its own {@link #duplicate()}.
 */
public final class Agenda {
    private final EnumMap<Category, LinkedHashMap<Expression, AgendaItem>> buckets = new EnumMap<>(Category.class);

    public Agenda() {
        for (Category c : Category.values()) buckets.put(c, new LinkedHashMap<>());
    }

    /**
     * @throws IllegalArgumentException if the expression cannot be categorized
     */
    public void insert(Expression e) {
        AgendaItem item = new AgendaItem(e);
        buckets.get(item.category()).putIfAbsent(e, item);
    }

    public void insertAll(Iterable<? extends Expression> es) {
        for (Expression e : es) insert(e);
    }

    /**
     * Re-add the atoms derived on a branch, negated where they were derived false.
     */
    public void insertAtoms(Map<Expression, Boolean> atoms) {
        atoms.forEach((atom, value) -> insert(value ? atom : new NegatedExpression(atom)));
    }

    /**
     * Remove and return the first item of the highest priority category, skipping items
     * marked exhausted (which stay put).
     */
    public Optional<AgendaItem> takeNext() {
        for (LinkedHashMap<Expression, AgendaItem> bucket : buckets.values()) {
            Iterator<AgendaItem> it = bucket.values().iterator();
            while (it.hasNext()) {
                AgendaItem item = it.next();
                if (!item.isExhausted()) {
                    it.remove();
                    return Optional.of(item);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Return a previously taken item, with its flags, to the back of its bucket.
     */
    public void putBack(AgendaItem item) {
        LinkedHashMap<Expression, AgendaItem> bucket = buckets.get(item.category());
        bucket.remove(item.expression());
        bucket.put(item.expression(), item);
    }

    public Agenda duplicate() {
        Agenda copy = new Agenda();
        buckets.forEach((c, bucket) -> {
            LinkedHashMap<Expression, AgendaItem> target = copy.buckets.get(c);
            bucket.forEach((e, item) -> target.put(e, item.copy()));
        });
        return copy;
    }

    /**
     * Clear the exhausted flag of every universal, typically because the branch gained a term.
     */
    public void refreshUniversals() {
        buckets.get(Category.ALL).values().forEach(AgendaItem::refresh);
    }

    public void refreshNegatedEqualities() {
        buckets.get(Category.NEGATED_EQUALITY).values().forEach(AgendaItem::refresh);
    }

    /**
     * Substitute {@code replacement} for the free occurrences of {@code variable} in every
     * held formula and in the terms the universals have been used with. A rewritten formula
     * may change bucket, or coincide with one already held, in which case the one already
     * in place wins.
     */
    public void replaceAll(Variable variable, Expression replacement, FreshVariables fresh) {
        EnumMap<Category, LinkedHashMap<Expression, AgendaItem>> old = new EnumMap<>(buckets);
        for (Category c : Category.values()) buckets.put(c, new LinkedHashMap<>());
        old.values().forEach(bucket -> bucket.values().forEach(item -> {
            AgendaItem mapped = item.map(e -> e.replace(variable, replacement, false, fresh));
            buckets.get(mapped.category()).putIfAbsent(mapped.expression(), mapped);
        }));
    }

    public boolean isEmpty() {
        return buckets.values().stream().allMatch(Map::isEmpty);
    }

    public int size() {
        return buckets.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * @return the formulas of one category, in the order they would be served
     */
    public ImmutableList<Expression> contents(Category category) {
        return ImmutableList.copyOf(buckets.get(category).keySet());
    }

    public ImmutableList<AgendaItem> items(Category category) {
        return ImmutableList.copyOf(buckets.get(category).values());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        buckets.forEach((c, bucket) -> {
            if (!bucket.isEmpty()) sb.append(c).append(": ").append(bucket.values()).append('\n');
        });
        return sb.toString();
    }
}
