package ca.gc.cra.leap.infrastructure.leap.libleap.cstruct;

import jnr.ffi.Runtime;
import jnr.ffi.Struct;

/**
 * JNR representation of the shim's {@code leap_image_info}.
 * <p>{@code data} and {@code distortion} point into the image list and stay valid only until
 * {@code leap_image_list_free}.</p>
 *
 * @since 0.1.0
 */
public final class ImageInfoStruct extends Struct {
  public final Signed64 sequenceId = new Signed64();
  /** Native camera id; 0 is left, 1 is right. */
  public final Signed32 cameraId = new Signed32();
  public final Signed32 valid = new Signed32();
  public final Signed64 timestamp = new Signed64();
  public final Signed32 width = new Signed32();
  public final Signed32 height = new Signed32();
  public final Signed32 bytesPerPixel = new Signed32();
  /** Number of floats behind {@link #distortion}. */
  public final Signed32 distortionLength = new Signed32();
  public final Pointer data = new Pointer();
  public final Pointer distortion = new Pointer();

  public ImageInfoStruct(Runtime runtime) {
    super(runtime);
  }
}
