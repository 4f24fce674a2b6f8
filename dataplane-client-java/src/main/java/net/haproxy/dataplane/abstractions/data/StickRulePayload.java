package net.haproxy.dataplane.abstractions.data;

import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.annotate.JsonSerialize;
import org.codehaus.jackson.map.annotate.JsonSerialize.Inclusion;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(include = Inclusion.NON_NULL)
public class StickRulePayload implements IndexedPayload {
  private Integer index;
  private String type;
  private String cond;
  private String condTest;
  private String pattern;
  private String table;

  public StickRulePayload() {
    super();
  }

  public StickRulePayload(Integer index, String type, String pattern) {
    super();
    this.index = index;
    this.type = type;
    this.pattern = pattern;
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

  @JsonProperty("pattern")
  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  @JsonProperty("table")
  public String getTable() {
    return table;
  }

  public void setTable(String table) {
    this.table = table;
  }
}
