package ca.gc.cra.leap.domain.image;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The most recent set of raw camera images, normally one per camera.
 *
 * <p>Receiving images requires {@link ca.gc.cra.leap.domain.Policy#IMAGES}.</p>
 *
 * @since 0.1.0
 */
public final class ImageList implements Iterable<Image> {
  private static final ImageList EMPTY = new ImageList(List.of());

  private final List<Image> images;

  /**
   * Creates a list over the supplied images.
   *
   * @param images images in service order; copied
   */
  public ImageList(List<Image> images) {
    this.images = List.copyOf(Objects.requireNonNull(images, "images"));
  }

  /**
   * Returns an empty list.
   *
   * @return shared empty list
   */
  public static ImageList empty() {
    return EMPTY;
  }

  public int size() {
    return images.size();
  }

  public boolean isEmpty() {
    return images.isEmpty();
  }

  /**
   * Returns the image at {@code index}.
   *
   * @param index position in service order
   * @return image
   */
  public Image get(int index) {
    return images.get(index);
  }

  @Override
  public Iterator<Image> iterator() {
    return images.iterator();
  }

  @Override
  public String toString() {
    return "ImageList" + images;
  }
}
