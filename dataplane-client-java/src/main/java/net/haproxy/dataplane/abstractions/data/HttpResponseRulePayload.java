package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class HttpResponseRulePayload implements IndexedPayload {
  private Integer index;
  private String type;
  private String cond;
  private String condTest;
  private String hdrName;
  private String hdrFormat;
  private String redirType;
  private String redirValue;
  private Long statusCode;
  private String statusReason;

  public HttpResponseRulePayload() {
    super();
  }

  public HttpResponseRulePayload(Integer index, String type) {
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

  @JsonProperty("cond")
  public String getCond() {
    return cond;
  }

  public void setCond(String cond) {
    this.cond = cond;
  }

  @JsonProperty("cond_test")
  public String getCondTest() {
    return condTest;
  }

  public void setCondTest(String condTest) {
    this.condTest = condTest;
  }

  @JsonProperty("hdr_name")
  public String getHdrName() {
    return hdrName;
  }

  public void setHdrName(String hdrName) {
    this.hdrName = hdrName;
  }

  @JsonProperty("hdr_format")
  public String getHdrFormat() {
    return hdrFormat;
  }

  public void setHdrFormat(String hdrFormat) {
    this.hdrFormat = hdrFormat;
  }

  @JsonProperty("redir_type")
  public String getRedirType() {
    return redirType;
  }

  public void setRedirType(String redirType) {
    this.redirType = redirType;
  }

  @JsonProperty("redir_value")
  public String getRedirValue() {
    return redirValue;
  }

  public void setRedirValue(String redirValue) {
    this.redirValue = redirValue;
  }

  @JsonProperty("status_code")
  public Long getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(Long statusCode) {
    this.statusCode = statusCode;
  }

  @JsonProperty("status_reason")
  public String getStatusReason() {
    return statusReason;
  }

  public void setStatusReason(String statusReason) {
    this.statusReason = statusReason;
  }
}
