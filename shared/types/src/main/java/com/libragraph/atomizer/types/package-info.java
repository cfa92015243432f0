/**
 * Pure Java value types shared across all atomizer modules.
 *
 * <p>{@link com.libragraph.atomizer.types.Modality} and the
 * {@link com.libragraph.atomizer.types.Subtypes} vocabulary.
 * ContentHash and buffer types live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.atomizer.types;
