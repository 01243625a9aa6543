/**
 * Image quality word, its bit descriptions, and the gate that decides whether an image is usable.
 */
package ca.gc.cra.helios.domain.quality;
