package dev.scriptorium.embedding;

import dev.scriptorium.error.CacheCorruptionException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;

/**
 * Binary format of a persisted embedding record.
 *
 * <pre>
 * magic "SCEC" (4 bytes) | version (1 byte) | fingerprint (32 bytes) | dimension (int) | floats
 * </pre>
 *
 * All multi-byte values are big-endian.
 */
final class EmbeddingRecordCodec {

  static final byte[] MAGIC = {'S', 'C', 'E', 'C'};
  static final byte VERSION = 1;

  private EmbeddingRecordCodec() {
    // utility class
  }

  static byte[] encode(String fingerprint, float[] vector) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(41 + vector.length * Float.BYTES);
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.write(MAGIC);
      out.writeByte(VERSION);
      out.write(Fingerprint.toBytes(fingerprint));
      out.writeInt(vector.length);
      for (float value : vector) {
        out.writeFloat(value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  /**
   * Decodes a record and checks it against the expected fingerprint and dimension.
   *
   * @throws CacheCorruptionException if the record is malformed or does not match
   */
  static float[] decode(byte[] data, String expectedFingerprint, int expectedDimension) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      byte[] magic = new byte[MAGIC.length];
      in.readFully(magic);
      if (!Arrays.equals(magic, MAGIC)) {
        throw new CacheCorruptionException("Bad magic in record " + expectedFingerprint);
      }
      byte version = in.readByte();
      if (version != VERSION) {
        throw new CacheCorruptionException(
            "Unsupported record version " + version + " for " + expectedFingerprint);
      }
      byte[] fingerprint = new byte[Fingerprint.BYTES];
      in.readFully(fingerprint);
      if (!Arrays.equals(fingerprint, Fingerprint.toBytes(expectedFingerprint))) {
        throw new CacheCorruptionException("Fingerprint mismatch for " + expectedFingerprint);
      }
      int dimension = in.readInt();
      if (dimension != expectedDimension) {
        throw new CacheCorruptionException(
            "Record "
                + expectedFingerprint
                + " has dimension "
                + dimension
                + ", expected "
                + expectedDimension);
      }
      float[] vector = new float[dimension];
      for (int i = 0; i < dimension; i++) {
        vector[i] = in.readFloat();
      }
      if (in.available() > 0) {
        throw new CacheCorruptionException("Trailing bytes in record " + expectedFingerprint);
      }
      return vector;
    } catch (EOFException e) {
      throw new CacheCorruptionException("Truncated record " + expectedFingerprint, e);
    } catch (IOException e) {
      throw new CacheCorruptionException("Unreadable record " + expectedFingerprint, e);
    }
  }
}
