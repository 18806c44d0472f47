/**
 * Product output adapters: corrected events and metadata as JSON, images in the TCI1 binary container.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.infrastructure.product;
