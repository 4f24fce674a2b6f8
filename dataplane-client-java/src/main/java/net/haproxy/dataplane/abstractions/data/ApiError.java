package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;

/**
 * Error body returned by the Data Plane API: <code>{"code": 409, "message": "..."}</code>.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiError {
  private Integer code;
  private String message;

  public ApiError() {
    super();
  }

  public ApiError(Integer code, String message) {
    super();
    this.code = code;
    this.message = message;
  }

  @JsonProperty("code")
  public Integer getCode() {
    return code;
  }

  public void setCode(Integer code) {
    this.code = code;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  @Override
  public String toString() {
    return "API error " + code + ": " + message;
  }
}
