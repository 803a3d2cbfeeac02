/**
 * Pure Java enums shared across all engine modules.
 *
 * <p>Every enum carries a stable numeric id that is what gets persisted,
 * so ids must never be renumbered. No framework dependencies.
 */
package com.aletheia.engine.types;
