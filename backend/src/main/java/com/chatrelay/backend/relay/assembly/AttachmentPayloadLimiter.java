package com.chatrelay.backend.relay.assembly;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the base64 payload of all inline images under the configured ceiling. Oversized images are
 * recompressed to an even share of 90% of the ceiling; if that is not enough the oldest images are
 * replaced by a text placeholder.
 */
@Component
public class AttachmentPayloadLimiter {

  private static final Logger log = LoggerFactory.getLogger(AttachmentPayloadLimiter.class);

  static final String DROPPED_PLACEHOLDER = "[Image omitted: attachment payload too large]";
  private static final double TARGET_RATIO = 0.9;

  private final ImageCompressor imageCompressor;
  private final RelayProperties properties;

  public AttachmentPayloadLimiter(ImageCompressor imageCompressor, RelayProperties properties) {
    this.imageCompressor = imageCompressor;
    this.properties = properties;
  }

  /** Rewrites image blocks of {@code messages} in place. */
  public void limit(ArrayNode messages) {
    long ceiling = properties.getAttachmentCeilingBytes();
    List<ImageSlot> images = collectImages(messages);
    long total = totalSize(images);
    if (images.isEmpty() || total <= ceiling) {
      return;
    }
    long shareBase64 = (long) (ceiling * TARGET_RATIO / images.size());
    long shareBytes = shareBase64 * 3 / 4;
    log.info(
        "Inline images total {} bytes over ceiling {}, compressing {} images to {} bytes each",
        total,
        ceiling,
        images.size(),
        shareBase64);

    for (ImageSlot image : images) {
      if (image.size() <= shareBase64) {
        continue;
      }
      Optional<byte[]> compressed =
          decode(image).flatMap(raw -> imageCompressor.compress(raw, shareBytes));
      if (compressed.isPresent()) {
        ObjectNode source = (ObjectNode) image.block().get("source");
        source.put("media_type", "image/jpeg");
        source.put("data", Base64.getEncoder().encodeToString(compressed.get()));
      }
    }

    long remaining = dropOldest(images, totalSize(images), ceiling, shareBase64);
    remaining = dropOldest(images, remaining, ceiling, 0);
    if (remaining > ceiling) {
      log.warn("Inline images still total {} bytes after dropping", remaining);
    }
  }

  /** Drops images larger than {@code minSize}, oldest first, until the total fits. */
  private static long dropOldest(List<ImageSlot> images, long total, long ceiling, long minSize) {
    for (ImageSlot image : images) {
      if (total <= ceiling) {
        break;
      }
      if (image.dropped() || image.size() <= minSize) {
        continue;
      }
      total -= image.size();
      image.drop();
      log.debug("Dropped inline image, payload now {} bytes", total);
    }
    return total;
  }

  private Optional<byte[]> decode(ImageSlot image) {
    try {
      return Optional.of(Base64.getDecoder().decode(image.data()));
    } catch (IllegalArgumentException ex) {
      log.warn("Inline image has invalid base64 data");
      return Optional.empty();
    }
  }

  private static List<ImageSlot> collectImages(ArrayNode messages) {
    List<ImageSlot> images = new ArrayList<>();
    for (JsonNode message : messages) {
      JsonNode content = message.get("content");
      if (content == null || !content.isArray()) {
        continue;
      }
      ArrayNode blocks = (ArrayNode) content;
      for (int i = 0; i < blocks.size(); i++) {
        JsonNode block = blocks.get(i);
        if (AgingPruner.isInlineImage(block)) {
          images.add(new ImageSlot(blocks, i));
        }
      }
    }
    return images;
  }

  private static long totalSize(List<ImageSlot> images) {
    return images.stream().mapToLong(ImageSlot::size).sum();
  }

  private static final class ImageSlot {
    private final ArrayNode container;
    private final int position;
    private boolean dropped;

    private ImageSlot(ArrayNode container, int position) {
      this.container = container;
      this.position = position;
    }

    JsonNode block() {
      return container.get(position);
    }

    String data() {
      return block().path("source").path("data").asText("");
    }

    long size() {
      return dropped ? 0 : data().length();
    }

    boolean dropped() {
      return dropped;
    }

    void drop() {
      ObjectNode placeholder = container.objectNode();
      placeholder.put("type", "text");
      placeholder.put("text", DROPPED_PLACEHOLDER);
      container.set(position, placeholder);
      dropped = true;
    }
  }
}
