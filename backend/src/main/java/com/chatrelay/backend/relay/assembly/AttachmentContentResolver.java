package com.chatrelay.backend.relay.assembly;

import com.chatrelay.backend.chat.domain.AttachmentKind;
import com.chatrelay.backend.chat.domain.MessageAttachment;
import com.chatrelay.backend.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Turns stored attachments into inline request content. */
@Component
public class AttachmentContentResolver {

  private static final Logger log = LoggerFactory.getLogger(AttachmentContentResolver.class);

  private final RelayProperties properties;
  private final ObjectMapper objectMapper;

  public AttachmentContentResolver(RelayProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public ObjectNode resolve(MessageAttachment attachment) {
    if (attachment.getKind() == AttachmentKind.IMAGE) {
      return resolveImage(attachment);
    }
    if (StringUtils.hasText(attachment.getExtractedText())) {
      return text(
          "[Document: " + attachment.getFileName() + "]\n" + attachment.getExtractedText());
    }
    return text(
        "[Attachment: " + attachment.getFileName() + " (" + attachment.getMimeType() + ")]");
  }

  private ObjectNode resolveImage(MessageAttachment attachment) {
    Path path = resolvePath(attachment.getStoragePath());
    byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (IOException ex) {
      log.warn(
          "Cannot read image attachment {} at {}: {}", attachment.getId(), path, ex.getMessage());
      return text("[Image unavailable: " + attachment.getFileName() + "]");
    }
    ObjectNode block = objectMapper.createObjectNode();
    block.put("type", "image");
    ObjectNode source = block.putObject("source");
    source.put("type", "base64");
    source.put("media_type", attachment.getMimeType());
    source.put("data", Base64.getEncoder().encodeToString(data));
    return block;
  }

  private Path resolvePath(String storagePath) {
    Path path = Path.of(storagePath);
    return path.isAbsolute() ? path : Path.of(properties.getAttachmentStorageRoot()).resolve(path);
  }

  private ObjectNode text(String value) {
    ObjectNode block = objectMapper.createObjectNode();
    block.put("type", "text");
    block.put("text", value);
    return block;
  }
}
