package ca.gc.cra.tagcal.infrastructure.product;

import ca.gc.cra.tagcal.domain.image.CsumImage;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.image.ImagePlane;
import ca.gc.cra.tagcal.domain.image.RateImage;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compact image container (TCI1): magic, plane count, then for every plane its name, shape, element type and
 * big-endian data.
 *
 * <p>Dense planes store every element; sparse planes store the non-zero count followed by
 * {@code (flat index, value)} pairs. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ImageContainerIO {
  private static final byte[] MAGIC = {'T', 'C', 'I', '1'};

  private ImageContainerIO() {}

  /** Element encoding of one plane. */
  public enum ElementType {
    FLOAT32,
    INT32,
    FLOAT32_SPARSE
  }

  /**
   * Writes the science, error and quality planes of a rate image.
   *
   * @param path output file
   * @param image image to store
   * @throws IOException when writing fails
   */
  public static void writeRateImage(Path path, RateImage image) throws IOException {
    try (Writer writer = new Writer(path, 3)) {
      writer.floats("SCI", image.science());
      writer.floats("ERR", image.error());
      writer.ints("DQ", image.quality());
    }
  }

  /**
   * Writes a cumulative-sum image as one sparse plane.
   *
   * @param path output file
   * @param image image to store
   * @throws IOException when writing fails
   */
  public static void writeCsum(Path path, CsumImage image) throws IOException {
    try (Writer writer = new Writer(path, 1)) {
      writer.sparse("SCI", image);
    }
  }

  /**
   * Reads every plane of a container.
   *
   * @param path container file
   * @return planes in stored order
   * @throws IOException when the file is unreadable or not a TCI1 container
   */
  public static List<StoredPlane> read(Path path) throws IOException {
    try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path), 1 << 16))) {
      byte[] magic = new byte[MAGIC.length];
      in.readFully(magic);
      if (!Arrays.equals(magic, MAGIC)) {
        throw new IOException("not a TCI1 image container: " + path);
      }
      int count = in.readInt();
      List<StoredPlane> planes = new ArrayList<>(count);
      for (int p = 0; p < count; p++) {
        String name = in.readUTF();
        int[] shape = new int[in.readInt()];
        long elements = 1;
        for (int d = 0; d < shape.length; d++) {
          shape[d] = in.readInt();
          elements *= shape[d];
        }
        ElementType type = ElementType.values()[in.readByte()];
        switch (type) {
          case FLOAT32: {
            float[] values = new float[Math.toIntExact(elements)];
            for (int i = 0; i < values.length; i++) {
              values[i] = in.readFloat();
            }
            planes.add(new StoredPlane(name, shape, type, values, null, null));
            break;
          }
          case INT32: {
            int[] values = new int[Math.toIntExact(elements)];
            for (int i = 0; i < values.length; i++) {
              values[i] = in.readInt();
            }
            planes.add(new StoredPlane(name, shape, type, null, values, null));
            break;
          }
          default: {
            long nonZero = in.readLong();
            TreeMap<Long, Float> cells = new TreeMap<>();
            for (long i = 0; i < nonZero; i++) {
              cells.put(in.readLong(), in.readFloat());
            }
            planes.add(new StoredPlane(name, shape, type, null, null, cells));
            break;
          }
        }
      }
      return planes;
    }
  }

  /**
   * One plane read back from a container; exactly one of the data fields is set, according to {@code type}.
   *
   * @param name plane name, e.g. {@code SCI}
   * @param shape dimensions, slowest-varying first
   * @param type element encoding
   * @param floats dense float data
   * @param ints dense integer data
   * @param sparse non-zero cells keyed by flat index
   */
  public record StoredPlane(
      String name, int[] shape, ElementType type, float[] floats, int[] ints, Map<Long, Float> sparse) {}

  /** Sequential plane writer. */
  static final class Writer implements Closeable {
    private final DataOutputStream out;

    Writer(Path path, int planes) throws IOException {
      this.out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path), 1 << 20));
      out.write(MAGIC);
      out.writeInt(planes);
    }

    void floats(String name, ImagePlane plane) throws IOException {
      header(name, new int[] {plane.rows(), plane.columns()}, ElementType.FLOAT32);
      for (float value : plane.data()) {
        out.writeFloat(value);
      }
    }

    void ints(String name, DqPlane plane) throws IOException {
      header(name, new int[] {plane.rows(), plane.columns()}, ElementType.INT32);
      for (int value : plane.data()) {
        out.writeInt(value);
      }
    }

    void sparse(String name, CsumImage image) throws IOException {
      int[] shape = image.isThreeDimensional()
          ? new int[] {image.planes(), image.rows(), image.columns()}
          : new int[] {image.rows(), image.columns()};
      header(name, shape, ElementType.FLOAT32_SPARSE);
      TreeMap<Long, Double> cells = image.nonZeroCells();
      out.writeLong(cells.size());
      for (Map.Entry<Long, Double> cell : cells.entrySet()) {
        out.writeLong(cell.getKey());
        out.writeFloat(cell.getValue().floatValue());
      }
    }

    private void header(String name, int[] shape, ElementType type) throws IOException {
      out.writeUTF(name);
      out.writeInt(shape.length);
      for (int dimension : shape) {
        out.writeInt(dimension);
      }
      out.writeByte(type.ordinal());
    }

    @Override
    public void close() throws IOException {
      out.close();
    }
  }
}
