package ca.gc.cra.leap.infrastructure.leap.libleap.cstruct;

import jnr.ffi.Runtime;
import jnr.ffi.Struct;

/**
 * JNR representation of the shim's {@code leap_frame_info}, filled by {@code leap_controller_frame}.
 *
 * @since 0.1.0
 */
public final class FrameInfoStruct extends Struct {
  public final Signed64 id = new Signed64();
  /** Capture time in microseconds on the service clock. */
  public final Signed64 timestamp = new Signed64();
  public final Float framesPerSecond = new Float();
  /** Non-zero when the service produced a valid frame. */
  public final Signed32 valid = new Signed32();

  public FrameInfoStruct(Runtime runtime) {
    super(runtime);
  }
}
