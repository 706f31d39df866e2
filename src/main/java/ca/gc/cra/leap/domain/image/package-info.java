/**
 * Camera image snapshots and their distortion maps.
 */
package ca.gc.cra.leap.domain.image;
