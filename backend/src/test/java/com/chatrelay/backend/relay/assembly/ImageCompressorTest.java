package com.chatrelay.backend.relay.assembly;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Random;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class ImageCompressorTest {

  private final ImageCompressor compressor = new ImageCompressor();

  @Test
  void noisyImageIsReencodedAsJpegWithinLimit() throws IOException {
    byte[] png = noisyPng(400, 300);

    Optional<byte[]> compressed = compressor.compress(png, png.length / 4);

    assertThat(compressed).isPresent();
    byte[] jpeg = compressed.get();
    assertThat(jpeg.length).isLessThanOrEqualTo(png.length / 4);
    assertThat(jpeg[0]).isEqualTo((byte) 0xFF);
    assertThat(jpeg[1]).isEqualTo((byte) 0xD8);
  }

  @Test
  void impossibleLimitYieldsNothing() throws IOException {
    assertThat(compressor.compress(noisyPng(200, 200), 10)).isEmpty();
  }

  @Test
  void undecodableBytesYieldNothing() {
    assertThat(compressor.compress(new byte[] {1, 2, 3, 4}, 1_000_000)).isEmpty();
  }

  private static byte[] noisyPng(int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Random random = new Random(3L);
    for (int x = 0; x < width; x++) {
      for (int y = 0; y < height; y++) {
        image.setRGB(x, y, random.nextInt(0xFFFFFF));
      }
    }
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    ImageIO.write(image, "png", buffer);
    return buffer.toByteArray();
  }
}
