package com.github.sybila.bisim;

import com.github.sybila.bisim.check.BisimilarityResult;
import org.jetbrains.annotations.NotNull;

/**
 * Receives the outcome of a comparison.
 */
public interface ResultReporter {

    <S> void report(@NotNull BisimilarityResult<S> result);

}
