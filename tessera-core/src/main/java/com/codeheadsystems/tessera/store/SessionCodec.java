package com.codeheadsystems.tessera.store;

import com.codeheadsystems.tessera.exceptions.PayloadTooLargeException;
import com.codeheadsystems.tessera.exceptions.SessionStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of session payloads and stored sessions, with the payload size bound applied on
 * every encode.
 * <p>
 * Stored session layout:
 * <pre>{@code
 *   {"createdAt": 1700000000000, "lastAccessedAt": ..., "expiresAt": ..., "payload": {...}}
 * }</pre>
 * Timestamps are epoch milliseconds.
 */
public class SessionCodec {

  private static final String CREATED_AT = "createdAt";
  private static final String LAST_ACCESSED_AT = "lastAccessedAt";
  private static final String EXPIRES_AT = "expiresAt";
  private static final String PAYLOAD = "payload";

  private final ObjectMapper mapper;
  private final int maxPayloadSize;

  /**
   * Instantiates a new Session codec.
   *
   * @param maxPayloadSize bound for the encoded payload in bytes
   */
  public SessionCodec(int maxPayloadSize) {
    this(new ObjectMapper(), maxPayloadSize);
  }

  /**
   * Instantiates a new Session codec.
   *
   * @param mapper         the object mapper
   * @param maxPayloadSize bound for the encoded payload in bytes
   */
  public SessionCodec(ObjectMapper mapper, int maxPayloadSize) {
    this.mapper = mapper;
    this.maxPayloadSize = maxPayloadSize;
  }

  /**
   * Encodes a payload as a JSON object.
   *
   * @param payload the payload
   * @return the bytes
   * @throws PayloadTooLargeException if the result exceeds the bound
   */
  public byte[] encodePayload(Map<String, JsonNode> payload) {
    ObjectNode node = mapper.createObjectNode();
    node.setAll(payload);
    byte[] bytes = write(node);
    if (bytes.length > maxPayloadSize) {
      throw new PayloadTooLargeException(bytes.length, maxPayloadSize);
    }
    return bytes;
  }

  /**
   * Decodes a payload written by {@link #encodePayload}.
   *
   * @param bytes the bytes
   * @return the payload
   * @throws SessionStoreException if the bytes are not a JSON object
   */
  public Map<String, JsonNode> decodePayload(byte[] bytes) {
    return fields(readObject(bytes), "payload");
  }

  /**
   * Encodes a stored session.
   *
   * @param session the stored session
   * @return the bytes
   * @throws PayloadTooLargeException if the payload exceeds the bound
   */
  public byte[] encode(StoredSession session) {
    encodePayload(session.payload());
    ObjectNode root = mapper.createObjectNode();
    root.put(CREATED_AT, session.createdAt().toEpochMilli());
    root.put(LAST_ACCESSED_AT, session.lastAccessedAt().toEpochMilli());
    root.put(EXPIRES_AT, session.expiresAt().toEpochMilli());
    root.putObject(PAYLOAD).setAll(session.payload());
    return write(root);
  }

  /**
   * Decodes a stored session written by {@link #encode}.
   *
   * @param bytes the bytes
   * @return the stored session
   * @throws SessionStoreException if the record is malformed
   */
  public StoredSession decode(byte[] bytes) {
    JsonNode root = readObject(bytes);
    JsonNode payload = root.get(PAYLOAD);
    if (!root.hasNonNull(CREATED_AT) || !root.hasNonNull(LAST_ACCESSED_AT)
        || !root.hasNonNull(EXPIRES_AT) || payload == null || !payload.isObject()) {
      throw new SessionStoreException("Unreadable session record: missing fields");
    }
    return new StoredSession(
        fields(payload, "record"),
        Instant.ofEpochMilli(root.get(CREATED_AT).asLong()),
        Instant.ofEpochMilli(root.get(LAST_ACCESSED_AT).asLong()),
        Instant.ofEpochMilli(root.get(EXPIRES_AT).asLong()));
  }

  private byte[] write(JsonNode node) {
    try {
      return mapper.writeValueAsBytes(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Session payload is not serializable", e);
    }
  }

  private JsonNode readObject(byte[] bytes) {
    try {
      JsonNode node = mapper.readTree(bytes);
      if (node == null || !node.isObject()) {
        throw new SessionStoreException("Unreadable session record: not a JSON object");
      }
      return node;
    } catch (IOException e) {
      throw new SessionStoreException("Unreadable session record", e);
    }
  }

  private static Map<String, JsonNode> fields(JsonNode node, String what) {
    if (!node.isObject()) {
      throw new SessionStoreException("Unreadable session " + what + ": not a JSON object");
    }
    Map<String, JsonNode> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      result.put(e.getKey(), e.getValue());
    }
    return result;
  }
}
