package net.littleredcomputer.inference.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.inference.AbstractTheoremTool;
import net.littleredcomputer.inference.ModelBuilder;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finds models by exhaustive search over small domains, smallest first. Every assignment of
 * individuals to constants is combined with every choice of relation extensions; a domain
 * size with more candidates than the configured limit is skipped.
 * <p>
 * Only function-free formulas are supported. A model found for assumptions and a negated
 * goal shows that the goal does not follow.
 */
public class FiniteModelBuilder extends AbstractTheoremTool implements ModelBuilder {
    private static final Logger log = LogManager.getFormatterLogger(FiniteModelBuilder.class);
    public static final int DEFAULT_MAX_DOMAIN_SIZE = 4;
    public static final long DEFAULT_MAX_CANDIDATES = 1L << 22;
    private final int maxDomainSize;
    private final long maxCandidates;

    public FiniteModelBuilder() {
        this(DEFAULT_MAX_DOMAIN_SIZE, DEFAULT_MAX_CANDIDATES);
    }

    public FiniteModelBuilder(int maxDomainSize) {
        this(maxDomainSize, DEFAULT_MAX_CANDIDATES);
    }

    public FiniteModelBuilder(int maxDomainSize, long maxCandidates) {
        super("finite");
        Preconditions.checkArgument(maxDomainSize > 0, "maxDomainSize must be positive");
        Preconditions.checkArgument(maxCandidates > 0, "maxCandidates must be positive");
        this.maxDomainSize = maxDomainSize;
        this.maxCandidates = maxCandidates;
    }

    @Override
    public Optional<Model> buildModel(Optional<Expression> goal, List<Expression> assumptions) {
        ImmutableList.Builder<Expression> b = ImmutableList.builder();
        for (Expression a : assumptions) b.add(a.simplify());
        goal.ifPresent(g -> b.add(new NegatedExpression(g.simplify())));
        ImmutableList<Expression> formulas = b.build();
        Signature signature = Signature.of(formulas);
        start();
        try {
            for (int n = 1; n <= maxDomainSize; ++n) {
                Optional<Model> m = candidates(signature, n).filter(c -> c.satisfiesAll(formulas)).findFirst();
                if (m.isPresent()) {
                    log.debug(() -> new FormattedMessage("%s: model of size %d after %d candidates in %s", name(), m.get().size(), stepCount, stopwatch()));
                    return m;
                }
            }
            log.debug("%s: no model up to size %d after %d candidates", name(), maxDomainSize, stepCount);
            return Optional.empty();
        } finally {
            stop();
        }
    }

    /**
     * @return every interpretation of the signature over a domain of the given size, or
     * nothing if there are more of them than the limit
     */
    Stream<Model> candidates(Signature signature, int size) {
        long tupleBits = 0;
        for (int arity : signature.relations().values()) tupleBits = Math.min(Long.SIZE, tupleBits + Math.min(Long.SIZE, Math.round(Math.pow(size, arity))));
        double count = Math.pow(size, signature.constants().size()) * Math.pow(2, tupleBits);
        if (tupleBits >= Long.SIZE - 1 || count > maxCandidates) {
            log.warn("%s: %.0f interpretations of size %d exceed the limit of %d; skipping", name(), count, size, maxCandidates);
            return Stream.empty();
        }
        return StreamSupport.stream(new Candidates(signature, size, (int) tupleBits), false);
    }

    /**
     * An odometer over interpretations. The low digits are the bits of the relation
     * extensions (one per possible tuple); the high digits assign each constant an individual.
     */
    private class Candidates implements Spliterator<Model> {
        private final int size;
        private final List<Variable> constants;
        private final Map<Variable, List<List<Integer>>> tuples = new LinkedHashMap<>();
        private final int[] assignment;
        private final long bitLimit;
        private long bits = 0;
        private boolean done = false;

        Candidates(Signature signature, int size, int tupleBits) {
            this.size = size;
            this.constants = new ArrayList<>(signature.constants());
            this.assignment = new int[constants.size()];
            this.bitLimit = 1L << tupleBits;
            signature.relations().forEach((r, arity) -> tuples.put(r, allTuples(size, arity)));
        }

        private Model current() {
            Map<Variable, Integer> c = new HashMap<>();
            for (int i = 0; i < assignment.length; ++i) c.put(constants.get(i), assignment[i]);
            Map<Variable, Set<List<Integer>>> r = new LinkedHashMap<>();
            int bit = 0;
            for (Map.Entry<Variable, List<List<Integer>>> e : tuples.entrySet()) {
                Set<List<Integer>> extension = new LinkedHashSet<>();
                for (List<Integer> t : e.getValue()) {
                    if ((bits & (1L << bit)) != 0) extension.add(t);
                    ++bit;
                }
                r.put(e.getKey(), extension);
            }
            return new Model(size, c, r);
        }

        private void advance() {
            if (++bits < bitLimit) return;
            bits = 0;
            for (int i = assignment.length - 1; i >= 0; --i) {
                if (++assignment[i] < size) return;
                assignment[i] = 0;
            }
            done = true;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Model> action) {
            if (done) return false;
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> "domain size " + size);
            action.accept(current());
            advance();
            return true;
        }

        @Override
        public Spliterator<Model> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return 0;
        }
    }

    /**
     * @return all tuples of the given length over {@code {0, ..., size-1}}, in lexicographic order
     */
    static List<List<Integer>> allTuples(int size, int arity) {
        List<List<Integer>> out = new ArrayList<>();
        int[] t = new int[arity];
        while (true) {
            ImmutableList.Builder<Integer> b = ImmutableList.builder();
            for (int x : t) b.add(x);
            out.add(b.build());
            int i = arity - 1;
            while (i >= 0 && ++t[i] == size) t[i--] = 0;
            if (i < 0) return out;
        }
    }
}
