/**
 * Pure Java value types shared across Framekit modules.
 *
 * <p>Digest algorithm identifiers and display resolutions. Content digests,
 * grids and the buffer layer live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.framekit.types;
