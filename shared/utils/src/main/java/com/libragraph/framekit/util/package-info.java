/**
 * Shared utilities for all Framekit modules.
 *
 * <ul>
 *   <li>{@link com.libragraph.framekit.util.collection collection}: ordered insertion into sorted lists</li>
 *   <li>{@link com.libragraph.framekit.util.grid grid}: rectangular / jagged layout conversion and transposition</li>
 *   <li>{@link com.libragraph.framekit.util.digest digest}: SHA-256 and MD5 over channels and text</li>
 *   <li>{@link com.libragraph.framekit.util.config config}: digest read settings</li>
 * </ul>
 */
package com.libragraph.framekit.util;
