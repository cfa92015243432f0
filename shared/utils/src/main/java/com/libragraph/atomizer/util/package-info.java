/**
 * Shared utilities for all atomizer modules.
 *
 * <p>Contains {@link com.libragraph.atomizer.util.ContentHash} (SHA-256),
 * {@link com.libragraph.atomizer.util.Fingerprint} and the
 * {@link com.libragraph.atomizer.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, FileBuffer).
 * No framework dependencies.
 */
package com.libragraph.atomizer.util;
