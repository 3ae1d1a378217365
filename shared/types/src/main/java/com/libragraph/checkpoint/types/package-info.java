/**
 * Pure Java value types shared across all checkpoint modules.
 *
 * <p>ContentHash and ContentRef live in {@code shared/utils}.
 * This module has no dependencies at all.
 */
package com.libragraph.checkpoint.types;
