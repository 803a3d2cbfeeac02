/**
 * Shared utilities for all engine modules.
 *
 * <p>Contains {@link com.aletheia.engine.util.ResultKey}, the canonical form used to group
 * verification results. No framework dependencies, pure Java.
 */
package com.aletheia.engine.util;
