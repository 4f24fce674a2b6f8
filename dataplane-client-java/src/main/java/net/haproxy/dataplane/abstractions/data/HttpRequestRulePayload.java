package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class HttpRequestRulePayload implements IndexedPayload {
  private Integer index;
  private String type;
  private String cond;
  private String condTest;
  private String hdrName;
  private String hdrFormat;
  private String hdrMatch;
  private String hdrMethod;
  private String redirType;
  private String redirValue;
  private Long redirCode;
  private Long statusCode;
  private String statusReason;
  private String logLevel;
  private String pathFmt;
  private String pathMatch;
  private String queryFmt;
  private String methodFmt;
  private String service;
  private String expr;
  private String timeout;
  private String luaAction;
  private String luaParams;
  private Long scId;
  private Long scIdx;

  public HttpRequestRulePayload() {
    super();
  }

  public HttpRequestRulePayload(Integer index, String type) {
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

  @JsonProperty("hdr_match")
  public String getHdrMatch() {
    return hdrMatch;
  }

  public void setHdrMatch(String hdrMatch) {
    this.hdrMatch = hdrMatch;
  }

  @JsonProperty("hdr_method")
  public String getHdrMethod() {
    return hdrMethod;
  }

  public void setHdrMethod(String hdrMethod) {
    this.hdrMethod = hdrMethod;
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

  @JsonProperty("redir_code")
  public Long getRedirCode() {
    return redirCode;
  }

  public void setRedirCode(Long redirCode) {
    this.redirCode = redirCode;
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

  @JsonProperty("log_level")
  public String getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(String logLevel) {
    this.logLevel = logLevel;
  }

  @JsonProperty("path_fmt")
  public String getPathFmt() {
    return pathFmt;
  }

  public void setPathFmt(String pathFmt) {
    this.pathFmt = pathFmt;
  }

  @JsonProperty("path_match")
  public String getPathMatch() {
    return pathMatch;
  }

  public void setPathMatch(String pathMatch) {
    this.pathMatch = pathMatch;
  }

  @JsonProperty("query_fmt")
  public String getQueryFmt() {
    return queryFmt;
  }

  public void setQueryFmt(String queryFmt) {
    this.queryFmt = queryFmt;
  }

  @JsonProperty("method_fmt")
  public String getMethodFmt() {
    return methodFmt;
  }

  public void setMethodFmt(String methodFmt) {
    this.methodFmt = methodFmt;
  }

  @JsonProperty("service")
  public String getService() {
    return service;
  }

  public void setService(String service) {
    this.service = service;
  }

  @JsonProperty("expr")
  public String getExpr() {
    return expr;
  }

  public void setExpr(String expr) {
    this.expr = expr;
  }

  @JsonProperty("timeout")
  public String getTimeout() {
    return timeout;
  }

  public void setTimeout(String timeout) {
    this.timeout = timeout;
  }

  @JsonProperty("lua_action")
  public String getLuaAction() {
    return luaAction;
  }

  public void setLuaAction(String luaAction) {
    this.luaAction = luaAction;
  }

  @JsonProperty("lua_params")
  public String getLuaParams() {
    return luaParams;
  }

  public void setLuaParams(String luaParams) {
    this.luaParams = luaParams;
  }

  @JsonProperty("sc_id")
  public Long getScId() {
    return scId;
  }

  public void setScId(Long scId) {
    this.scId = scId;
  }

  @JsonProperty("sc_idx")
  public Long getScIdx() {
    return scIdx;
  }

  public void setScIdx(Long scIdx) {
    this.scIdx = scIdx;
  }
}
