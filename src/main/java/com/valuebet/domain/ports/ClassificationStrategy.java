package com.valuebet.domain.ports;

import com.valuebet.domain.model.ClassificationResult;

/**
 * Decides what an unknown token is. Implementations may mutate the directory
 * (attach an alias, create an entity) before answering.
 */
public interface ClassificationStrategy {

    ClassificationResult classify(String token, EntityDirectory directory);
}
