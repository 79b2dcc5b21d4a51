package com.hrintake.telegram.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Входящее сообщение Telegram; для контакта, документа и фото {@code text} пустой. */
public record IncomingMessage(
    String chatId,
    String userId,
    String messageId,
    String text,
    String contactPhone,
    Attachment attachment) {

  public static IncomingMessage from(JsonNode message) {
    String chatId = message.path("chat").path("id").asText();
    String userId = message.path("from").path("id").asText();
    String messageId = message.path("message_id").asText(null);
    String text = message.path("text").asText("");

    JsonNode contact = message.path("contact");
    String phone = null;
    if (!contact.isMissingNode() && !contact.isNull()) {
      phone = contact.path("phone_number").asText(null);
    }

    return new IncomingMessage(chatId, userId, messageId, text, phone, attachmentOf(message));
  }

  private static Attachment attachmentOf(JsonNode message) {
    JsonNode document = message.path("document");
    if (document.hasNonNull("file_id")) {
      return new Attachment(document.get("file_id").asText(), AttachmentKind.DOCUMENT);
    }
    // Telegram lists photo sizes in ascending order; the last one is the largest.
    JsonNode photo = message.path("photo");
    if (photo.isArray() && !photo.isEmpty()) {
      JsonNode largest = photo.get(photo.size() - 1);
      if (largest.hasNonNull("file_id")) {
        return new Attachment(largest.get("file_id").asText(), AttachmentKind.PHOTO);
      }
    }
    return null;
  }

  public boolean hasContact() {
    return contactPhone != null && !contactPhone.isBlank();
  }
}
