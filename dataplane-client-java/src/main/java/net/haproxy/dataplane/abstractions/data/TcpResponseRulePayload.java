package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class TcpResponseRulePayload implements IndexedPayload {
  private Integer index;
  private String type;
  private String action;
  private String cond;
  private String condTest;
  private Long timeout;
  private String luaAction;
  private String luaParams;
  private Long scId;
  private Long scIdx;

  public TcpResponseRulePayload() {
    super();
  }

  public TcpResponseRulePayload(Integer index, String type, String action) {
    super();
    this.index = index;
    this.type = type;
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

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  @JsonProperty("action")
  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
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

  @JsonProperty("timeout")
  public Long getTimeout() {
    return timeout;
  }

  public void setTimeout(Long timeout) {
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
