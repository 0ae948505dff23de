package net.littleredcomputer.logic;

import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Source of globally unique individual variables {@code z1, z2, ...}. Every variable minted
 * for alpha conversion, existential witnesses and universal instantiation within one proof
 * must come from the same instance.
 */
public final class FreshVariables {
    private static final FreshVariables shared = new FreshVariables();
    private static final Pattern freshRe = Pattern.compile("z[0-9]+");
    private final AtomicLong counter = new AtomicLong();

    public static FreshVariables shared() { return shared; }

    public Variable next() {
        return new Variable("z" + counter.incrementAndGet());
    }

    public long issued() { return counter.get(); }

    static boolean looksFresh(Variable v) {
        return freshRe.matcher(v.name()).matches();
    }
}
