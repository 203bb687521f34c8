package com.di.moduleflow.dataset;

/**
 * One step of a module's transform chain. Stages are applied in order, each consuming the
 * previous stage's output.
 */
@FunctionalInterface
public interface TransformStage {

    Dataset apply(Dataset input);

    /** Composes {@code this} then {@code next}. */
    default TransformStage andThen(TransformStage next) {
        return input -> next.apply(apply(input));
    }
}
