package com.chatrelay.backend.relay.assembly;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Re-encodes images as JPEG, trading resolution and quality for size. */
@Component
public class ImageCompressor {

  private static final Logger log = LoggerFactory.getLogger(ImageCompressor.class);

  static final double[] SCALES = {1.0, 0.75, 0.5, 0.35, 0.25};
  static final float[] QUALITIES = {0.85f, 0.6f, 0.4f, 0.25f};
  private static final int MIN_SIDE = 100;

  /**
   * @return JPEG bytes no larger than {@code maxBytes}, or empty if the image cannot be decoded or
   *     does not fit at any tried scale and quality
   */
  public Optional<byte[]> compress(byte[] source, long maxBytes) {
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(source));
    } catch (IOException ex) {
      log.debug("Unreadable image of {} bytes: {}", source.length, ex.getMessage());
      return Optional.empty();
    }
    if (image == null) {
      return Optional.empty();
    }
    int width = image.getWidth();
    int height = image.getHeight();
    for (double scale : SCALES) {
      int scaledWidth = (int) (width * scale);
      int scaledHeight = (int) (height * scale);
      if (scale < 1.0 && (scaledWidth < MIN_SIDE || scaledHeight < MIN_SIDE)) {
        continue;
      }
      BufferedImage scaled = toRgb(image, Math.max(1, scaledWidth), Math.max(1, scaledHeight));
      for (float quality : QUALITIES) {
        try {
          byte[] encoded = encodeJpeg(scaled, quality);
          if (encoded.length <= maxBytes) {
            log.debug(
                "Compressed image from {} to {} bytes (scale {}, quality {})",
                source.length,
                encoded.length,
                scale,
                quality);
            return Optional.of(encoded);
          }
        } catch (IOException ex) {
          log.debug("JPEG encoding failed: {}", ex.getMessage());
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

  private static BufferedImage toRgb(BufferedImage image, int width, int height) {
    BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = target.createGraphics();
    graphics.setRenderingHint(
        RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
    graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    graphics.setColor(Color.WHITE);
    graphics.fillRect(0, 0, width, height);
    graphics.drawImage(image, 0, 0, width, height, null);
    graphics.dispose();
    return target;
  }

  private static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(quality);
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (MemoryCacheImageOutputStream output = new MemoryCacheImageOutputStream(buffer)) {
      writer.setOutput(output);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
    return buffer.toByteArray();
  }
}
