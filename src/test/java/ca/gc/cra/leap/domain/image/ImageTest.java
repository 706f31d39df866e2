package ca.gc.cra.leap.domain.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.leap.domain.Timestamp;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ImageTest {

  @Test
  void pixelDataIsCopiedAndAddressableByRow() {
    byte[] pixels = {0, 1, 2, (byte) 200, 4, 5};
    Image image = new Image(true, 7L, Camera.LEFT, new Timestamp(99L), 3, 2, 1, pixels, new float[0]);
    pixels[0] = 42;

    ImageData data = image.data();
    assertEquals(6, data.length());
    assertEquals(0, data.pixel(0, 0));
    assertEquals(200, data.pixel(0, 1));
    assertThrows(IndexOutOfBoundsException.class, () -> data.pixel(3, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> data.pixel(0, 2));

    List<byte[]> rows = data.rows();
    assertEquals(2, rows.size());
    assertArrayEquals(new byte[] {0, 1, 2}, rows.get(0));
    assertArrayEquals(new byte[] {(byte) 200, 4, 5}, rows.get(1));
  }

  @Test
  void pixelBufferMustMatchDimensions() {
    assertThrows(IllegalArgumentException.class,
        () -> new Image(true, 1L, Camera.RIGHT, new Timestamp(0L), 2, 2, 1, new byte[3], null));
  }

  @Test
  void distortionMapUsesFixedStride() {
    float[] map = new float[DistortionData.STRIDE * DistortionData.HEIGHT];
    int offset = 2 * DistortionData.STRIDE + 3 * 2;
    map[offset] = 0.25f;
    map[offset + 1] = 1.5f;
    Image image = new Image(true, 1L, Camera.RIGHT, new Timestamp(0L), 0, 0, 1, new byte[0], map);

    DistortionData distortion = image.distortion();
    assertEquals(DistortionData.WIDTH, distortion.width());
    assertEquals(DistortionData.HEIGHT, distortion.height());

    DistortionEntry entry = distortion.entry(3, 2);
    assertEquals(0.25f, entry.u());
    assertEquals(1.5f, entry.v());
    assertFalse(entry.isValid());
    assertTrue(distortion.entry(0, 0).isValid());
    assertEquals(entry, distortion.rows().get(2).get(3));
    assertEquals(DistortionData.HEIGHT, distortion.rows().size());
  }

  @Test
  void cameraIdsMapToLeftAndRight() {
    assertEquals(Camera.LEFT, Camera.fromImageId(0));
    assertEquals(Camera.RIGHT, Camera.fromImageId(1));
    assertThrows(IllegalStateException.class, () -> Camera.fromImageId(2));
  }

  @Test
  void imageListIsImmutableSnapshot() {
    Image image = new Image(true, 1L, Camera.LEFT, new Timestamp(0L), 1, 1, 1, new byte[1], null);
    List<Image> source = new ArrayList<>(List.of(image));
    ImageList list = new ImageList(source);
    source.clear();

    assertEquals(1, list.size());
    assertFalse(list.isEmpty());
    assertEquals(image, list.iterator().next());
    assertTrue(ImageList.empty().isEmpty());
  }
}
