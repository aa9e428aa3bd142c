package com.bashnorm.normalize;

import com.bashnorm.ast.RootNode;

import java.util.Optional;

public sealed interface NormalizationResult {
    record Success(RootNode tree) implements NormalizationResult {}
    record Failure(ErrorKind kind, String message) implements NormalizationResult {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * The normalized tree, or empty if normalization failed.
     */
    default Optional<RootNode> normalizedTree() {
        return this instanceof Success success ? Optional.of(success.tree()) : Optional.empty();
    }
}
