/**
 * JNR struct mirrors of the {@code LeapShim} C types. Field order matches the C declarations.
 */
package ca.gc.cra.leap.infrastructure.leap.libleap.cstruct;
