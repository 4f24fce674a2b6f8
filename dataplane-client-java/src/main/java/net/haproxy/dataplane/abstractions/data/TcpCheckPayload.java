package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

/**
 * Single <code>tcp-check</code> directive of a backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class TcpCheckPayload implements IndexedPayload {
  private Integer index;
  private String action;
  private String comment;
  private Long port;
  private String address;
  private String data;
  private Long minRecv;
  private String onSuccess;
  private String onError;
  private String statusCode;
  private Long timeout;
  private String logLevel;

  public TcpCheckPayload() {
    super();
  }

  public TcpCheckPayload(Integer index, String action) {
    super();
    this.index = index;
    this.action = action;
  }

  @Override
  @JsonProperty("index")
  public Integer getIndex() {
    return index;
  }

  public void setIndex(Integer index) {
    this.index = index;
  }

  @JsonProperty("action")
  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
  }

  @JsonProperty("comment")
  public String getComment() {
    return comment;
  }

  public void setComment(String comment) {
    this.comment = comment;
  }

  @JsonProperty("port")
  public Long getPort() {
    return port;
  }

  public void setPort(Long port) {
    this.port = port;
  }

  @JsonProperty("address")
  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  @JsonProperty("data")
  public String getData() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  @JsonProperty("min_recv")
  public Long getMinRecv() {
    return minRecv;
  }

  public void setMinRecv(Long minRecv) {
    this.minRecv = minRecv;
  }

  @JsonProperty("on_success")
  public String getOnSuccess() {
    return onSuccess;
  }

  public void setOnSuccess(String onSuccess) {
    this.onSuccess = onSuccess;
  }

  @JsonProperty("on_error")
  public String getOnError() {
    return onError;
  }

  public void setOnError(String onError) {
    this.onError = onError;
  }

  @JsonProperty("status_code")
  public String getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(String statusCode) {
    this.statusCode = statusCode;
  }

  @JsonProperty("timeout")
  public Long getTimeout() {
    return timeout;
  }

  public void setTimeout(Long timeout) {
    this.timeout = timeout;
  }

  @JsonProperty("log_level")
  public String getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(String logLevel) {
    this.logLevel = logLevel;
  }
}
