package net.haproxy.dataplane.abstractions.data;

import org.apache.commons.lang.StringUtils;

public enum ApiVersion {
  V2("v2", ResponseShape.DATA_WRAPPED),
  V3("v3", ResponseShape.BARE);

  private final String pathSegment;
  private final ResponseShape responseShape;

  private ApiVersion(String pathSegment, ResponseShape responseShape) {
    this.pathSegment = pathSegment;
    this.responseShape = responseShape;
  }

  public String getPathSegment() {
    return pathSegment;
  }

  public ResponseShape getResponseShape() {
    return responseShape;
  }

  /**
   * v3 addresses child entities through their parent (<code>/backends/b1/servers</code>),
   * v2 uses flat collections filtered by query parameters.
   */
  public boolean usesNestedPaths() {
    return this != V2;
  }

  public static ApiVersion fromString(String value) {
    if (StringUtils.isBlank(value)) {
      return V3;
    }
    for (ApiVersion version : values()) {
      if (version.pathSegment.equalsIgnoreCase(value.trim())) {
        return version;
      }
    }
    throw new IllegalArgumentException("Unsupported API version: " + value + ". Use v2 or v3.");
  }

  @Override
  public String toString() {
    return pathSegment;
  }
}
