package net.littleredcomputer.inference;

import net.littleredcomputer.inference.model.Model;
import net.littleredcomputer.logic.Expression;

import java.util.List;
import java.util.Optional;

public class ModelBuilderCommand extends TheoremToolCommand {
    private final ModelBuilder builder;
    private Optional<Model> model;

    public ModelBuilderCommand(ModelBuilder builder, Optional<Expression> goal, List<Expression> assumptions) {
        super(goal, assumptions);
        this.builder = builder;
    }

    public ModelBuilder builder() { return builder; }

    /**
     * @return whether a model was found, running the builder if no answer is cached
     */
    public boolean buildModel() {
        if (model == null) model = builder.buildModel(goal(), assumptions());
        return model.isPresent();
    }

    /**
     * @throws IllegalStateException if {@link #buildModel()} has not run since the last change
     */
    public Optional<Model> model() {
        if (model == null) throw new IllegalStateException("You have to call buildModel() first to get a model!");
        return model;
    }

    @Override
    protected void reset() {
        model = null;
    }
}
