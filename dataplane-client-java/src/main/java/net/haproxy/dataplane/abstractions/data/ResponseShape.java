package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.JsonNode;

/**
 * How an API version lays out response payloads.
 */
public enum ResponseShape {
  /**
   * Payload is the body itself: an array for collections, an object for single entities.
   */
  BARE {
    @Override
    public JsonNode unwrap(JsonNode body) {
      if (body != null && body.isObject() && isEnvelope(body)) {
        return body.get(Constants.DATA_ENVELOPE_FIELD);
      }
      return body;
    }
  },

  /**
   * Payload is wrapped in <code>{"data": ...}</code>.
   */
  DATA_WRAPPED {
    @Override
    public JsonNode unwrap(JsonNode body) {
      if (body != null && body.isObject() && body.has(Constants.DATA_ENVELOPE_FIELD)) {
        return body.get(Constants.DATA_ENVELOPE_FIELD);
      }
      return body;
    }
  };

  /**
   * Extracts the payload from a decoded response body. The other version's layout is accepted too,
   * since some endpoints answer in it regardless of the version prefix.
   * @param body decoded body, may be null for empty responses
   * @return payload node, null when the body was empty
   */
  public abstract JsonNode unwrap(JsonNode body);

  private static boolean isEnvelope(JsonNode body) {
    if (!body.has(Constants.DATA_ENVELOPE_FIELD)) {
      return false;
    }
    JsonNode data = body.get(Constants.DATA_ENVELOPE_FIELD);
    return data.isArray() || data.isObject();
  }
}
