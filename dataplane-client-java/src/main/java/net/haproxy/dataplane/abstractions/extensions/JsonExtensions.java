package net.haproxy.dataplane.abstractions.extensions;

import java.io.IOException;

import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;

import org.apache.commons.lang.StringUtils;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.JsonParser;
import org.codehaus.jackson.map.DeserializationConfig;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.map.SerializationConfig;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;


public class JsonExtensions {

  private static final ObjectMapper DEFAULT_MAPPER = createDefaultJsonSerializer();

  public static ObjectMapper createDefaultJsonSerializer() {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.disable(DeserializationConfig.Feature.FAIL_ON_UNKNOWN_PROPERTIES);
    objectMapper.configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
    objectMapper.disable(SerializationConfig.Feature.FAIL_ON_EMPTY_BEANS);
    objectMapper.setSerializationInclusion(Inclusion.NON_NULL);
    return objectMapper;
  }

  public static ObjectMapper getDefaultObjectMapper() {
    return DEFAULT_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return DEFAULT_MAPPER.writeValueAsString(value);
    } catch (IOException e) {
      throw new ServerClientException("Unable to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  /**
   * @return parsed tree, or null when text is blank
   */
  public static JsonNode parseTree(String text) {
    if (StringUtils.isBlank(text)) {
      return null;
    }
    try {
      return DEFAULT_MAPPER.readTree(text);
    } catch (IOException e) {
      throw new ServerClientException("Unable to parse response: " + StringUtils.abbreviate(text, 200), e);
    }
  }

  public static <T> T fromTree(JsonNode node, Class<T> clazz) {
    try {
      return DEFAULT_MAPPER.readValue(node, clazz);
    } catch (IOException e) {
      throw new ServerClientException("Unable to read " + clazz.getSimpleName() + " from " + node, e);
    }
  }

}
