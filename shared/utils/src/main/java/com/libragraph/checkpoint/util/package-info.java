/**
 * Shared utilities for all checkpoint modules.
 *
 * <p>Contains {@link com.libragraph.checkpoint.util.ContentHash} (BLAKE3-128) and
 * {@link com.libragraph.checkpoint.util.ContentRef}. No framework dependencies, only
 * commons-codec for BLAKE3.
 */
package com.libragraph.checkpoint.util;
