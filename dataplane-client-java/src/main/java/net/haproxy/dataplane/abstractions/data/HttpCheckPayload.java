package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

/**
 * Single <code>http-check</code> directive of a backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class HttpCheckPayload implements IndexedPayload {
  private Integer index;
  private String type;
  private String addr;
  private Long port;
  private String match;
  private String pattern;
  private String method;
  private String uri;
  private String version;
  private String exclamationMark;
  private String logLevel;
  private String sendProxy;
  private String viaSocks4;
  private String checkComment;

  public HttpCheckPayload() {
    super();
  }

  public HttpCheckPayload(Integer index, String type) {
    super();
    this.index = index;
    this.type = type;
  }

  @Override
  @JsonProperty("index")
  public Integer getIndex() {
    return index;
  }

  public void setIndex(Integer index) {
    this.index = index;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  @JsonProperty("addr")
  public String getAddr() {
    return addr;
  }

  public void setAddr(String addr) {
    this.addr = addr;
  }

  @JsonProperty("port")
  public Long getPort() {
    return port;
  }

  public void setPort(Long port) {
    this.port = port;
  }

  @JsonProperty("match")
  public String getMatch() {
    return match;
  }

  public void setMatch(String match) {
    this.match = match;
  }

  @JsonProperty("pattern")
  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  @JsonProperty("method")
  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  @JsonProperty("uri")
  public String getUri() {
    return uri;
  }

  public void setUri(String uri) {
    this.uri = uri;
  }

  @JsonProperty("version")
  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  @JsonProperty("exclamation_mark")
  public String getExclamationMark() {
    return exclamationMark;
  }

  public void setExclamationMark(String exclamationMark) {
    this.exclamationMark = exclamationMark;
  }

  @JsonProperty("log_level")
  public String getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(String logLevel) {
    this.logLevel = logLevel;
  }

  @JsonProperty("send_proxy")
  public String getSendProxy() {
    return sendProxy;
  }

  public void setSendProxy(String sendProxy) {
    this.sendProxy = sendProxy;
  }

  @JsonProperty("via_socks4")
  public String getViaSocks4() {
    return viaSocks4;
  }

  public void setViaSocks4(String viaSocks4) {
    this.viaSocks4 = viaSocks4;
  }

  @JsonProperty("check_comment")
  public String getCheckComment() {
    return checkComment;
  }

  public void setCheckComment(String checkComment) {
    this.checkComment = checkComment;
  }
}
