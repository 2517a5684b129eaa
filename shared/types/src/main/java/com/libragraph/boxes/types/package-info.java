/**
 * Pure Java value types shared across all Boxes modules.
 *
 * <p>Content hashing lives in {@code shared/utils}; the algebra lives in {@code modules/core}.
 * This module has no dependencies.
 */
package com.libragraph.boxes.types;
