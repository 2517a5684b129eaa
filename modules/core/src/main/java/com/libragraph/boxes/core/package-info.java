/**
 * Box algebra: canonical signed multisets of atoms whose labels may themselves be boxes.
 *
 * <p>{@link com.libragraph.boxes.core.Box} is the value type; {@link com.libragraph.boxes.core.BoxAlgebra}
 * implements its operators and {@link com.libragraph.boxes.core.Canonicalizer} is the only
 * path by which boxes are created.
 */
package com.libragraph.boxes.core;
