package net.littleredcomputer.logic;

import com.google.common.base.Preconditions;

import java.util.regex.Pattern;

/**
 * A named variable. Two variables are the same iff their names match. Whether a variable
 * denotes an individual or a predicate/constant is a function of its name alone.
 */
public final class Variable implements Comparable<Variable> {
    private static final Pattern individualRe = Pattern.compile("[a-z][0-9]*");
    private final String name;

    public Variable(String name) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "variable name must be nonempty");
        this.name = name;
    }

    public String name() { return name; }

    /**
     * @return true if this variable names an individual: one lowercase letter
     * optionally followed by digits.
     */
    public boolean isIndividual() {
        return isIndividualName(name);
    }

    public static boolean isIndividualName(String name) {
        return individualRe.matcher(name).matches();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public int compareTo(Variable o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
