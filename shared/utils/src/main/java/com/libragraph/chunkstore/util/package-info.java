/**
 * Shared utilities for all chunkstore modules.
 *
 * <p>Contains {@link com.libragraph.chunkstore.util.ContentHash} (BLAKE3-256).
 * No framework dependencies; commons-codec supplies the digest.
 */
package com.libragraph.chunkstore.util;
