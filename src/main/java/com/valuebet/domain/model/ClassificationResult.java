package com.valuebet.domain.model;

/**
 * Answer of a classification strategy for a token the directory does not know.
 */
public sealed interface ClassificationResult {

    /** The token was attached as an alias of an entity that already existed. */
    record ExistingEntity(EntityKind kind, String canonicalName) implements ClassificationResult {}

    /** A new entity was created for the token. */
    record NewEntity(EntityKind kind, String canonicalName) implements ClassificationResult {}

    /** Leave the token unresolved. */
    record Ignore() implements ClassificationResult {}

    /** The answer was not usable; ask again. */
    record Retry(String reason) implements ClassificationResult {}

    static ClassificationResult ignore() {
        return new Ignore();
    }
}
