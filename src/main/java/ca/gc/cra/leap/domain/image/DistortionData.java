package ca.gc.cra.leap.domain.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calibration map for one camera image.
 *
 * <p>The map is a low-resolution image in which every cell holds a {@link DistortionEntry}. Each row stores
 * {@code width * 2} floats, interleaved as {@code u, v}.</p>
 *
 * @since 0.1.0
 */
public final class DistortionData {
  /** Cells per row reported by the service. */
  public static final int WIDTH = 64;
  /** Rows reported by the service. */
  public static final int HEIGHT = 64;
  /** Floats per row. */
  public static final int STRIDE = WIDTH * 2;

  private final float[] raw;
  private final int stride;

  DistortionData(float[] raw, int stride) {
    this.raw = Objects.requireNonNull(raw, "raw");
    if (stride <= 0 || stride % 2 != 0) {
      throw new IllegalArgumentException("stride must be a positive even number");
    }
    this.stride = stride;
  }

  /**
   * Returns the number of entries per row.
   *
   * @return map width
   */
  public int width() {
    return stride / 2;
  }

  /**
   * Returns the number of complete rows.
   *
   * @return map height
   */
  public int height() {
    return raw.length / stride;
  }

  /**
   * Returns a copy of the interleaved float data.
   *
   * @return raw {@code u, v} pairs
   */
  public float[] raw() {
    return raw.clone();
  }

  /**
   * Returns the entry at the given cell.
   *
   * @param x column in {@code [0, width())}
   * @param y row in {@code [0, height())}
   * @return distortion entry
   */
  public DistortionEntry entry(int x, int y) {
    Objects.checkIndex(x, width());
    Objects.checkIndex(y, height());
    int off = y * stride + x * 2;
    return new DistortionEntry(raw[off], raw[off + 1]);
  }

  /**
   * Returns the map as rows of entries.
   *
   * @return immutable rows
   */
  public List<List<DistortionEntry>> rows() {
    int w = width();
    int h = height();
    List<List<DistortionEntry>> rows = new ArrayList<>(h);
    for (int y = 0; y < h; y++) {
      List<DistortionEntry> row = new ArrayList<>(w);
      for (int x = 0; x < w; x++) {
        row.add(entry(x, y));
      }
      rows.add(List.copyOf(row));
    }
    return List.copyOf(rows);
  }
}
