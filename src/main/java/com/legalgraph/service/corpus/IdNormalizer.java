package com.legalgraph.service.corpus;

import java.util.Optional;

/**
 * Converts a raw matched substring into a corpus' canonical id format.
 * Implementations must be pure; an empty result means the text does not
 * have a valid id shape.
 */
@FunctionalInterface
public interface IdNormalizer {

    Optional<String> normalize(String raw);
}
