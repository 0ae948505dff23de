package net.littleredcomputer.inference;

import net.littleredcomputer.inference.model.Model;
import net.littleredcomputer.logic.Expression;

import java.util.List;
import java.util.Optional;

/**
 * Tries to build a model of the assumptions. Given a goal as well, the model sought is a
 * countermodel: one satisfying the assumptions and the negation of the goal.
 */
public interface ModelBuilder {
    Optional<Model> buildModel(Optional<Expression> goal, List<Expression> assumptions);
}
